package com.svdac.parser;

import com.svdac.model.ConditionTag;
import com.svdac.model.FlatStatement;
import com.svdac.model.LineText;
import com.svdac.model.SourceToken;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * 语句展平器
 * <p>
 * 在共享的 {@link TokenCursor} 上做相互递归的下降：括号、begin/end、if/else、case/endcase。
 * 输出互相独立的语句列表，嵌套在 if/case 中的语句带上对应的条件标注。
 * <p>
 * 每层只记录本层的条件（不是所有外层条件的合取），标注从内到外依次追加。
 * 游标耗尽时视为所有未闭合的作用域自然结束，不报错。
 */
@Component
public class StatementFlattener {

    private static final Logger log = LoggerFactory.getLogger(StatementFlattener.class);

    private static final Pattern HAS_ALPHA = Pattern.compile("[a-zA-Z]");
    private static final Set<String> STATEMENT_TERMINATORS = Set.of(";", "for", "endgenerate", "endfunction");
    private static final Set<String> CASE_KEYWORDS = Set.of("case", "casez", "casex");

    /**
     * 展平整个文件的 token 序列
     */
    public List<FlatStatement> flatten(List<SourceToken> tokens) {
        TokenCursor cursor = new TokenCursor(tokens);
        Scope scope = new Scope();
        while (cursor.hasNext()) {
            scope.consume(cursor.next(), cursor);
        }
        return scope.statements();
    }

    /**
     * 括号表达式，游标位于 '(' 之后。返回 "(a + b)" 形式的整体文本，行号取左括号所在行
     */
    LineText parenthesized(TokenCursor cursor, SourceToken open) {
        LineText text = LineText.of(open);
        while (cursor.hasNext()) {
            SourceToken token = cursor.next();
            SourceTokenizer.requireAtomicParentheses(token);
            if (token.is("(")) {
                text = appendGroup(stripCallee(text), parenthesized(cursor, token));
            } else if (token.is(")")) {
                return text.withText(text.text().strip() + ")");
            } else {
                text = text.append(token);
            }
        }
        return text;
    }

    /**
     * begin/end 块，游标位于 begin 之后
     */
    List<FlatStatement> block(TokenCursor cursor) {
        // 去掉块标签 "begin : name"
        if (cursor.nextIs(":")) {
            cursor.skip(2);
        }
        Scope scope = new Scope();
        while (cursor.hasNext()) {
            SourceToken token = cursor.next();
            if (token.is("end")) {
                return scope.statements();
            }
            scope.consume(token, cursor);
        }
        return scope.statements();
    }

    /**
     * if [else] 结构，游标位于 if 之后
     */
    List<FlatStatement> conditional(TokenCursor cursor) {
        String condition = condition(cursor);
        if (condition == null) {
            return List.of();
        }
        List<FlatStatement> result = new ArrayList<>(
                tag(branch(cursor), ConditionTag.ifTag(condition)));
        if (cursor.nextIs("else")) {
            cursor.next();
            result.addAll(tag(branch(cursor), ConditionTag.ifTag("! " + condition)));
        }
        return result;
    }

    /**
     * case/endcase 结构，游标位于 case 之后。case 分支内不要求 begin/end
     */
    List<FlatStatement> caseBody(TokenCursor cursor) {
        String selector = condition(cursor);
        if (selector == null) {
            return List.of();
        }
        Scope scope = new Scope();
        while (cursor.hasNext()) {
            SourceToken token = cursor.next();
            if (token.is("endcase")) {
                break;
            }
            scope.consume(token, cursor);
        }
        return tag(scope.statements(), ConditionTag.caseTag(selector));
    }

    /**
     * if 的一个分支：begin/end 块、嵌套的 if/case，或者以 ';' 结束的单条语句
     */
    private List<FlatStatement> branch(TokenCursor cursor) {
        if (cursor.nextIs("if")) {
            cursor.next();
            return conditional(cursor);
        }
        SourceToken first = cursor.peek();
        if (first != null && CASE_KEYWORDS.contains(first.text())) {
            cursor.next();
            return caseBody(cursor);
        }
        LineText line = LineText.empty();
        while (cursor.hasNext()) {
            SourceToken token = cursor.next();
            if (token.is("begin")) {
                // 例如 "for (...) begin ... end"，循环头不单独成句
                return block(cursor);
            }
            if (token.is("(")) {
                line = appendGroup(stripCallee(line), parenthesized(cursor, token));
                continue;
            }
            line = line.append(token);
            if (token.is(";")) {
                return line.isBlank() ? List.of() : List.of(FlatStatement.of(line));
            }
        }
        return List.of();
    }

    /**
     * 读取 if/case 后面的括号表达式
     */
    private String condition(TokenCursor cursor) {
        while (cursor.hasNext()) {
            SourceToken token = cursor.next();
            if (token.is("(")) {
                return parenthesized(cursor, token).text();
            }
        }
        return null;
    }

    private static List<FlatStatement> tag(List<FlatStatement> statements, ConditionTag tag) {
        return statements.stream()
                .map(s -> s.withCondition(tag))
                .toList();
    }

    private static LineText appendGroup(LineText line, LineText group) {
        return line.append(group).append(" ");
    }

    /**
     * 去掉紧挨在 '(' 前面的标识符（函数名、例化名），避免括号内的变量被当成赋值目标
     */
    static LineText stripCallee(LineText line) {
        String text = line.text();
        if (!text.contains(" ")) {
            return line;
        }
        String trimmed = text.stripTrailing();
        int cut = trimmed.lastIndexOf(' ');
        String prefix = trimmed.substring(0, cut + 1);
        String last = trimmed.substring(cut + 1);
        // 括号内的第一个 token 与左括号相连，只去掉标识符部分
        if (last.startsWith("(")) {
            prefix = prefix + "(";
            last = last.substring(1);
        }
        if (last.isEmpty() || last.endsWith(")") || !HAS_ALPHA.matcher(last).find()) {
            return line;
        }
        return line.withText(prefix);
    }

    /**
     * 一层作用域内正在累积的语句
     */
    private final class Scope {

        private final List<FlatStatement> statements = new ArrayList<>();
        private LineText line = LineText.empty();

        void consume(SourceToken token, TokenCursor cursor) {
            String text = token.text();
            if (token.is("(")) {
                line = appendGroup(stripCallee(line), parenthesized(cursor, token));
            } else if (token.is("if")) {
                flush();
                statements.addAll(conditional(cursor));
            } else if (CASE_KEYWORDS.contains(text)) {
                flush();
                statements.addAll(caseBody(cursor));
            } else if (token.is("begin")) {
                flush();
                statements.addAll(block(cursor));
            } else {
                line = line.append(token);
                if (STATEMENT_TERMINATORS.contains(text)) {
                    flush();
                }
            }
        }

        private void flush() {
            if (!line.isBlank()) {
                FlatStatement statement = FlatStatement.of(line);
                log.trace("语句结束: {}", statement);
                statements.add(statement);
            }
            line = LineText.empty();
        }

        List<FlatStatement> statements() {
            return statements;
        }
    }
}
