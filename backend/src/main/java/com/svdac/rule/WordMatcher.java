package com.svdac.rule;

import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;

/**
 * 整词匹配
 * <p>
 * 规则模式按正则片段处理（例如 "[0]" 匹配下标 0），匹配前把 '_' 视为分词符，
 * 因此 "s1" 能匹配 "data_s1"，但不会匹配 "data_s10"。
 */
@Component
public class WordMatcher {

    static final int MAX_CACHED_PATTERNS = 4096;

    private final Map<String, Pattern> patternCache = new ConcurrentHashMap<>();

    public boolean isWordIn(String word, String text) {
        return compile(word).matcher(toWords(text)).find();
    }

    /**
     * 编译模式，语法错误时抛出 {@link java.util.regex.PatternSyntaxException}
     */
    public Pattern compile(String word) {
        Pattern cached = patternCache.get(word);
        if (cached != null) {
            return cached;
        }
        // 超过上限时整体清空
        if (patternCache.size() >= MAX_CACHED_PATTERNS) {
            patternCache.clear();
        }
        return patternCache.computeIfAbsent(word,
                w -> Pattern.compile("\\b(" + toWords(w) + ")\\b"));
    }

    int cachedPatterns() {
        return patternCache.size();
    }

    private static String toWords(String text) {
        return text.replace(' ', '\t').replace('_', ' ');
    }
}
