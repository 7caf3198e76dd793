package com.svdac.cli;

import com.svdac.model.DacRule;
import com.svdac.model.Violation;
import com.svdac.service.ScanListener;

import java.io.PrintStream;
import java.util.List;

/**
 * 把规则和违规即时打印到终端
 */
class ConsoleScanListener implements ScanListener {

    private final PrintStream out;
    private final ConsoleStyle style;
    private final boolean printRules;

    ConsoleScanListener(PrintStream out, ConsoleStyle style, boolean printRules) {
        this.out = out;
        this.style = style;
        this.printRules = printRules;
    }

    @Override
    public void rulesCompiled(String fileName, List<DacRule> rules) {
        if (!printRules) {
            return;
        }
        out.println(fileName + ": " + rules.size() + " rules");
        for (DacRule rule : rules) {
            StringBuilder sb = new StringBuilder("  DACrule: ")
                    .append(rule.describe())
                    .append(" -- ").append(rule.getIgnore());
            if (rule.hasExclusions()) {
                sb.append(" (exclude ").append(rule.getExclude()).append(")");
            }
            out.println(sb);
        }
    }

    @Override
    public void violationFound(Violation violation) {
        String operand = violation.getOperand();
        out.println(style.red() + "Rule " + violation.getRule().describe()
                + " violation (" + style.yellow() + operand + style.red() + "):" + style.reset());
        out.println("\t(" + violation.getFileName() + " near line " + violation.getLineNumber() + ")");
        out.println("\t" + violation.getStatement().replace(operand, style.underlineYellow() + operand + style.reset()));
    }
}
