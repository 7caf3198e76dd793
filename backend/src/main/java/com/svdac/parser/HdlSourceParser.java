package com.svdac.parser;

import com.svdac.model.FlatStatement;
import com.svdac.model.SourceToken;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * HDL 源码解析器
 * <p>
 * 预处理 → 分词 → 展平，把文件内容拆成带行号和条件标注的独立语句，供规则检查复用。
 */
@Component
public class HdlSourceParser {

    private static final Logger log = LoggerFactory.getLogger(HdlSourceParser.class);

    private final SourcePreprocessor preprocessor;
    private final SourceTokenizer tokenizer;
    private final StatementFlattener flattener;

    public HdlSourceParser(SourcePreprocessor preprocessor, SourceTokenizer tokenizer, StatementFlattener flattener) {
        this.preprocessor = preprocessor;
        this.tokenizer = tokenizer;
        this.flattener = flattener;
    }

    /**
     * 解析文件内容，返回展平后的语句列表
     *
     * @param content  文件内容（已去掉忽略标记所在的行）
     * @param fileName 文件名（用于日志）
     * @return 语句列表
     */
    public List<FlatStatement> parse(String content, String fileName) {
        String code = preprocessor.preprocess(content);
        List<SourceToken> tokens = tokenizer.tokenize(code);
        List<FlatStatement> statements = flattener.flatten(tokens);
        log.info("从 {} 中解析出 {} 条语句 ({} 个 token)", fileName, statements.size(), tokens.size());
        return statements;
    }
}
