package com.svdac.parser;

import com.svdac.exception.MalformedTokenException;
import com.svdac.model.SourceToken;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 按行把预处理后的文本切成 token，并记录每个 token 的行号
 */
@Component
public class SourceTokenizer {

    private static final Pattern TOKEN = Pattern.compile("\\S+");

    public List<SourceToken> tokenize(String preprocessed) {
        List<SourceToken> tokens = new ArrayList<>();
        String[] lines = preprocessed.split("\n", -1);
        for (int i = 0; i < lines.length; i++) {
            Matcher matcher = TOKEN.matcher(lines[i]);
            while (matcher.find()) {
                SourceToken token = new SourceToken(matcher.group(), i + 1);
                requireAtomicParentheses(token);
                tokens.add(token);
            }
        }
        return tokens;
    }

    /**
     * 括号必须是独立 token，否则说明预处理没有正确补空格
     */
    static void requireAtomicParentheses(SourceToken token) {
        String text = token.text();
        if (text.length() > 1 && (text.contains("(") || text.contains(")"))) {
            throw new MalformedTokenException(text, token.lineNumber());
        }
    }
}
