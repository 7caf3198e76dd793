package com.svdac.rule;

import com.svdac.exception.RuleRangeMismatchException;
import com.svdac.exception.RuleSyntaxException;
import com.svdac.model.DacRule;
import com.svdac.model.DacRule.AssignOperator;
import com.svdac.model.RuleKey;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;
import java.util.stream.IntStream;

/**
 * 内嵌规则编译器
 * <p>
 * 源码注释中的规则声明格式：
 * <pre>
 * // DACrule: s0-3, p0-3 = s0-3, p0-3, [0-3] -- OKcomb
 * // DACrule: s1-3, p1-3 &lt;= s0-2, p0-2, [0-2] -- OKreg
 * // DACexception: srst, time_cnt_
 * </pre>
 * 左右两侧都是逗号分隔的列表，元素可以带数字范围 {@code low-high}。
 * 展开后左侧第 k 个序号与右侧每个带范围元素的第 k 个取值配对，
 * 上例第一条展开为 {@code s0 = [s0, p0, [0]]}、{@code s1 = [s1, p1, [1]]} ……
 */
@Component
public class RuleCompiler {

    private static final Logger log = LoggerFactory.getLogger(RuleCompiler.class);

    private static final Pattern EMBEDDED_RULE = Pattern.compile("DACrule: (.*)");
    private static final Pattern EMBEDDED_EXCEPTION = Pattern.compile("DACexception: (.*)");
    private static final Pattern NUMBER_RANGE = Pattern.compile("(\\d+)-(\\d+)");
    private static final String IGNORE_SEPARATOR = "--";
    static final int MAX_RANGE_WIDTH = 1024;

    private final WordMatcher wordMatcher;

    public RuleCompiler(WordMatcher wordMatcher) {
        this.wordMatcher = wordMatcher;
    }

    /**
     * 提取文件中所有 "DACrule:" 声明（冒号之后的部分）
     */
    public List<String> extractDeclarations(String content) {
        return findAll(EMBEDDED_RULE, content);
    }

    /**
     * 提取文件中所有 "DACexception:" 声明的例外子串
     */
    public List<String> extractExceptions(String content) {
        return findAll(EMBEDDED_EXCEPTION, content).stream()
                .flatMap(raw -> Arrays.stream(raw.split(",")))
                .map(String::strip)
                .filter(s -> !s.isEmpty())
                .toList();
    }

    /**
     * 把规则声明编译为具体规则
     *
     * @param declarations     规则声明，例如 "s0-2 = s0-2 -- OKcomb"
     * @param defaultIgnoreTag 声明中没有 "--" 时使用的忽略标记
     * @return 按首次声明顺序排列的规则；同一左侧模式和运算符的后声明覆盖先声明
     */
    public List<DacRule> compile(List<String> declarations, String defaultIgnoreTag) {
        Map<RuleKey, DacRule> rules = new LinkedHashMap<>();
        for (String declaration : declarations) {
            for (DacRule rule : compileDeclaration(declaration, defaultIgnoreTag)) {
                // LinkedHashMap 覆盖时保持原位置
                rules.put(rule.key(), rule);
            }
        }
        List<DacRule> compiled = new ArrayList<>(rules.values());
        addSubsetExclusions(compiled);
        log.info("从 {} 条内嵌声明编译出 {} 条规则", declarations.size(), compiled.size());
        return compiled;
    }

    List<DacRule> compileDeclaration(String declaration, String defaultIgnoreTag) {
        AssignOperator assign = detectOperator(declaration);
        int opIdx = declaration.indexOf(assign.symbol());
        String lhs = declaration.substring(0, opIdx);
        String rest = declaration.substring(opIdx + assign.symbol().length());

        String rhs = rest;
        String ignore = defaultIgnoreTag;
        int ignoreIdx = rest.indexOf(IGNORE_SEPARATOR);
        if (ignoreIdx >= 0) {
            rhs = rest.substring(0, ignoreIdx);
            ignore = rest.substring(ignoreIdx + IGNORE_SEPARATOR.length()).strip();
        }

        ExpandedList left = expand(lhs, declaration);
        ExpandedList right = expand(rhs, declaration);
        if (left.elements().isEmpty() || right.elements().isEmpty()) {
            throw new RuleSyntaxException("内嵌规则缺少左侧或右侧: " + declaration);
        }
        if (left.stride() != right.stride()) {
            throw new RuleRangeMismatchException(declaration, left.stride(), right.stride());
        }

        List<DacRule> result = new ArrayList<>();
        for (Element leftElement : left.elements()) {
            for (int k = 0; k < leftElement.values().size(); k++) {
                result.add(DacRule.builder()
                        .left(leftElement.values().get(k))
                        .right(pairedPatterns(leftElement, k, right))
                        .assign(assign)
                        .ignore(ignore)
                        .build());
            }
        }
        return result;
    }

    /**
     * 左侧第 k 个取值对应的右侧模式：带范围的元素取第 k 个，不带范围的元素共享；
     * 不带范围的左侧元素得到右侧全部取值
     */
    private List<String> pairedPatterns(Element leftElement, int k, ExpandedList right) {
        List<String> patterns = new ArrayList<>();
        for (Element rightElement : right.elements()) {
            if (!rightElement.ranged()) {
                patterns.add(rightElement.values().get(0));
            } else if (leftElement.ranged()) {
                patterns.add(rightElement.values().get(k));
            } else {
                patterns.addAll(rightElement.values());
            }
        }
        return patterns;
    }

    /**
     * 展开逗号列表。带范围的元素把其中所有范围替换为同一个序号
     */
    ExpandedList expand(String raw, String declaration) {
        List<Element> elements = new ArrayList<>();
        Integer stride = null;
        for (String part : raw.split(",")) {
            String item = part.strip();
            if (item.isEmpty()) {
                continue;
            }
            Matcher matcher = NUMBER_RANGE.matcher(item);
            if (!matcher.find()) {
                validatePattern(item, declaration);
                elements.add(new Element(List.of(item), false));
                continue;
            }
            int low = parseBound(matcher.group(1), declaration);
            int high = parseBound(matcher.group(2), declaration);
            if (high < low) {
                throw new RuleSyntaxException("数字范围上限小于下限 (" + matcher.group() + "): " + declaration);
            }
            int width = high - low + 1;
            if (width > MAX_RANGE_WIDTH) {
                throw new RuleSyntaxException("数字范围过宽 (" + matcher.group() + ", 上限 " + MAX_RANGE_WIDTH
                        + "): " + declaration);
            }
            if (stride != null && stride != width) {
                throw new RuleRangeMismatchException(
                        "同一侧的数字范围宽度不一致 (" + stride + " 与 " + width + "): " + declaration);
            }
            stride = width;
            List<String> values = IntStream.rangeClosed(low, high)
                    .mapToObj(i -> NUMBER_RANGE.matcher(item).replaceAll(String.valueOf(i)))
                    .toList();
            values.forEach(v -> validatePattern(v, declaration));
            elements.add(new Element(values, true));
        }
        return new ExpandedList(elements, stride == null ? 1 : stride);
    }

    /**
     * 同一运算符下，若某条规则的左侧模式是另一条的真子串，较短的规则排除较长的模式，
     * 避免 s0 的规则命中 s0_c
     */
    private void addSubsetExclusions(List<DacRule> rules) {
        for (DacRule rule : rules) {
            for (DacRule other : rules) {
                if (rule.getAssign() == other.getAssign()
                        && !rule.getLeft().equals(other.getLeft())
                        && other.getLeft().contains(rule.getLeft())) {
                    rule.getExclude().add(other.getLeft());
                }
            }
        }
    }

    private AssignOperator detectOperator(String declaration) {
        if (declaration.contains(AssignOperator.NONBLOCKING.symbol())) {
            return AssignOperator.NONBLOCKING;
        }
        if (declaration.contains(AssignOperator.BLOCKING.symbol())) {
            return AssignOperator.BLOCKING;
        }
        throw new RuleSyntaxException("内嵌规则缺少赋值运算符 '=' 或 '<=': " + declaration);
    }

    private static int parseBound(String digits, String declaration) {
        try {
            return Integer.parseInt(digits);
        } catch (NumberFormatException e) {
            throw new RuleSyntaxException("数字范围超出整数范围 (" + digits + "): " + declaration, e);
        }
    }

    private void validatePattern(String pattern, String declaration) {
        try {
            wordMatcher.compile(pattern);
        } catch (PatternSyntaxException e) {
            throw new RuleSyntaxException("内嵌规则中的模式无法解析 (" + pattern + "): " + declaration, e);
        }
    }

    private static List<String> findAll(Pattern pattern, String content) {
        List<String> result = new ArrayList<>();
        Matcher matcher = pattern.matcher(content);
        while (matcher.find()) {
            result.add(matcher.group(1));
        }
        return result;
    }

    /** 列表中的一个元素及其展开结果 */
    record Element(List<String> values, boolean ranged) {
    }

    /** 展开后的列表；stride 为带范围元素的宽度，没有范围时为 1 */
    record ExpandedList(List<Element> elements, int stride) {
    }
}
