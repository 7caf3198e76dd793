package com.svdac.rule.checker;

import com.svdac.model.ConditionTag;
import com.svdac.model.DacRule;
import com.svdac.model.FlatStatement;
import com.svdac.model.LineText;
import com.svdac.model.Violation;
import com.svdac.parser.SourcePreprocessor;
import com.svdac.rule.WordMatcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 检查赋值语句右侧的变量是否属于规则允许的域
 * <p>
 * 只看第一个赋值运算符：左侧需整词匹配规则的左侧模式，右侧每个变量需整词匹配任一右侧模式。
 * 全大写常量、数字字面量、条件标注以及命中例外子串的语句不参与检查。
 */
@Component
public class AssignmentChecker implements StatementChecker {

    private static final Logger log = LoggerFactory.getLogger(AssignmentChecker.class);

    // Verilog 带进制字面量（8'hFF、4'sb1010）整体作为一个操作数
    private static final Pattern OPERAND = Pattern.compile(
            "\\d*'[sS]?[bBoOdDhH][0-9a-fA-FxXzZ_?]+|[\\w.\\[\\]$:]+");
    private static final Pattern BASED_LITERAL = Pattern.compile("\\d*'[sS]?[bBoOdDhH][0-9a-fA-FxXzZ_?]+");
    private static final Pattern HAS_ALPHA = Pattern.compile("[a-zA-Z]");
    private static final char[] BASE_PREFIXES = {'h', 'd', 'b', 'o'};

    private final WordMatcher wordMatcher;

    public AssignmentChecker(WordMatcher wordMatcher) {
        this.wordMatcher = wordMatcher;
    }

    @Override
    public CheckResult check(FlatStatement statement, DacRule rule, CheckContext context) {
        String code = SourcePreprocessor.collapseArrayIndices(statement.code());
        LineText full = new LineText(SourcePreprocessor.collapseArrayIndices(statement.text()),
                statement.lineNumber());

        String assign = rule.getAssign().spaced();
        if (!truncateAfterFirstAssign(code).contains(assign)) {
            return CheckResult.notApplicable();
        }
        List<LineText> halves = full.splitFirst(assign);
        if (halves.size() < 2) {
            return CheckResult.notApplicable();
        }
        String leftHand = halves.get(0).text();
        String rightHand = halves.get(1).text();

        if (isExcluded(rule, leftHand) || !wordMatcher.isWordIn(rule.getLeft(), leftHand)) {
            return CheckResult.notApplicable();
        }

        List<String> operands = extractOperands(rightHand);
        if (operands.isEmpty()) {
            if (context.isVerbose()) {
                log.info("右侧没有变量: {}", full);
            }
            return CheckResult.notApplicable();
        }

        int passes = 0;
        List<Violation> violations = new ArrayList<>();
        for (String operand : operands) {
            SkipReason reason = skipReason(operand, full.text(), context);
            if (reason != null) {
                if (context.isVerbose() && reason.verbose) {
                    log.info("忽略{} {} (第 {} 行)", reason.description, operand, full.lineNumber());
                }
                continue;
            }
            if (matchesAny(rule.getRight(), operand)) {
                passes++;
                continue;
            }
            Violation violation = Violation.builder()
                    .rule(rule)
                    .fileName(context.getFileName())
                    .lineNumber(full.lineNumber())
                    .operand(operand)
                    .statement(full.text())
                    .message("规则 " + rule.describe() + " 违规: " + operand)
                    .build();
            violations.add(violation);
            context.report(violation);
        }
        return new CheckResult(passes, violations);
    }

    /**
     * 只比较到第一个 '=' 为止，避免越过真正的赋值运算符
     */
    static String truncateAfterFirstAssign(String code) {
        int idx = code.indexOf('=');
        if (idx < 0) {
            return code;
        }
        return code.substring(0, Math.min(code.length(), idx + 2));
    }

    static List<String> extractOperands(String rightHand) {
        List<String> operands = new ArrayList<>();
        Matcher matcher = OPERAND.matcher(rightHand);
        while (matcher.find()) {
            operands.add(matcher.group());
        }
        return operands;
    }

    static SkipReason skipReason(String operand, String statementText, CheckContext context) {
        if (isAllUpperCase(operand)) {
            return SkipReason.CONSTANT;
        }
        if (isNumericLiteral(operand)) {
            return SkipReason.LITERAL;
        }
        if (!HAS_ALPHA.matcher(operand).find()) {
            return SkipReason.NO_ALPHA;
        }
        if (ConditionTag.Kind.isMarker(operand)) {
            return SkipReason.CONDITION_MARKER;
        }
        if (context.isExcepted(statementText)) {
            return SkipReason.EXCEPTION;
        }
        return null;
    }

    private boolean isExcluded(DacRule rule, String leftHand) {
        if (!rule.hasExclusions()) {
            return false;
        }
        return rule.getExclude().stream().anyMatch(exc -> wordMatcher.isWordIn(exc, leftHand));
    }

    private boolean matchesAny(List<String> patterns, String operand) {
        return patterns.stream().anyMatch(p -> wordMatcher.isWordIn(p, operand));
    }

    /**
     * 至少含一个字母且没有小写字母
     */
    static boolean isAllUpperCase(String text) {
        boolean hasCased = false;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (Character.isLowerCase(c)) {
                return false;
            }
            if (Character.isUpperCase(c)) {
                hasCased = true;
            }
        }
        return hasCased;
    }

    /**
     * 纯数字、带进制字面量，或去掉两端进制前缀字母（如 "b0"、"h10"）后为纯数字
     */
    static boolean isNumericLiteral(String text) {
        if (isDigits(text) || BASED_LITERAL.matcher(text).matches()) {
            return true;
        }
        for (char prefix : BASE_PREFIXES) {
            if (isDigits(strip(text, prefix))) {
                return true;
            }
        }
        return false;
    }

    private static boolean isDigits(String text) {
        if (text.isEmpty()) {
            return false;
        }
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c < '0' || c > '9') {
                return false;
            }
        }
        return true;
    }

    private static String strip(String text, char c) {
        int begin = 0;
        int end = text.length();
        while (begin < end && text.charAt(begin) == c) {
            begin++;
        }
        while (end > begin && text.charAt(end - 1) == c) {
            end--;
        }
        return text.substring(begin, end);
    }

    enum SkipReason {
        CONSTANT("全大写常量", true),
        LITERAL("数字字面量", true),
        NO_ALPHA("无字母的操作数", false),
        CONDITION_MARKER("条件标注", false),
        EXCEPTION("例外语句中的变量", true);

        private final String description;
        private final boolean verbose;

        SkipReason(String description, boolean verbose) {
            this.description = description;
            this.verbose = verbose;
        }
    }
}
