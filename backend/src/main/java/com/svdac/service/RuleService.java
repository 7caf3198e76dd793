package com.svdac.service;

import com.svdac.config.SvDacProperties;
import com.svdac.model.DacRule;
import com.svdac.model.DacRule.AssignOperator;
import com.svdac.rule.RuleCompiler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * 规则管理服务
 * <p>
 * 文件中有内嵌规则时只使用内嵌规则，否则使用默认规则表。
 */
@Service
public class RuleService {

        private static final Logger log = LoggerFactory.getLogger(RuleService.class);

        private static final List<String> DEFAULT_DOMAIN_FAMILIES = List.of("r", "s", "d");
        private static final int DEFAULT_STAGE_COUNT = 6;

        private final RuleCompiler ruleCompiler;
        private final SvDacProperties properties;
        private final List<DacRule> defaultRules;

        public RuleService(RuleCompiler ruleCompiler, SvDacProperties properties) {
                this.ruleCompiler = ruleCompiler;
                this.properties = properties;
                this.defaultRules = buildDefaultRules();
                log.info("加载了 {} 条默认规则", defaultRules.size());
        }

        /**
         * 默认规则表的副本
         */
        public List<DacRule> getDefaultRules() {
                return copyOf(defaultRules);
        }

        /**
         * 文件适用的规则：内嵌规则优先，没有时返回默认规则
         */
        public List<DacRule> rulesFor(String content) {
                List<String> declarations = ruleCompiler.extractDeclarations(content);
                if (declarations.isEmpty()) {
                        return getDefaultRules();
                }
                return ruleCompiler.compile(declarations, properties.getDefaultIgnoreTag());
        }

        /**
         * 文件中声明的例外子串
         */
        public List<String> exceptionsFor(String content) {
                return ruleCompiler.extractExceptions(content);
        }

        private static List<DacRule> copyOf(List<DacRule> rules) {
                return rules.stream()
                                .map(r -> r.toBuilder()
                                                .right(new ArrayList<>(r.getRight()))
                                                .exclude(new ArrayList<>(r.getExclude()))
                                                .build())
                                .toList();
        }

        /**
         * r/s/d 三类域各 6 级：每级 n 的 '=' 只能来自同级，'<=' 推进到 n+1 级只能来自第 n 级
         */
        private List<DacRule> buildDefaultRules() {
                List<DacRule> rules = new ArrayList<>();
                String ignore = properties.getDefaultIgnoreTag();
                for (String family : DEFAULT_DOMAIN_FAMILIES) {
                        for (int stage = 0; stage < DEFAULT_STAGE_COUNT; stage++) {
                                rules.add(DacRule.builder()
                                                .left(family + (stage + 1))
                                                .right(new ArrayList<>(List.of(family + stage)))
                                                .assign(AssignOperator.NONBLOCKING)
                                                .ignore(ignore)
                                                .build());
                                rules.add(DacRule.builder()
                                                .left(family + stage)
                                                .right(new ArrayList<>(List.of(family + stage)))
                                                .assign(AssignOperator.BLOCKING)
                                                .ignore(ignore)
                                                .build());
                        }
                }
                return rules;
        }
}
