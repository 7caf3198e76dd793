package com.svdac.service;

import com.svdac.config.SvDacProperties;
import com.svdac.exception.StopOnFirstViolationException;
import com.svdac.model.DacRule;
import com.svdac.model.FlatStatement;
import com.svdac.model.ScanOptions;
import com.svdac.model.ScanReport;
import com.svdac.model.Violation;
import com.svdac.parser.HdlSourceParser;
import com.svdac.parser.SourcePreprocessor;
import com.svdac.rule.checker.CheckContext;
import com.svdac.rule.checker.StatementChecker;
import com.svdac.rule.checker.StatementChecker.CheckResult;
import com.svdac.util.TextDecodingUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.*;
import java.util.concurrent.atomic.AtomicReference;

/**
 * HDL 源码扫描服务
 * <p>
 * 每个文件独立处理：编译规则 → 清除忽略行 → 提取例外 → 展平语句 → 语句与规则逐对检查。
 * 文件之间只累加通过数与违规数。
 */
@Service
public class ScanService {

    private static final Logger log = LoggerFactory.getLogger(ScanService.class);

    private final HdlSourceParser sourceParser;
    private final SourcePreprocessor preprocessor;
    private final RuleService ruleService;
    private final StatementChecker checker;
    private final SvDacProperties properties;
    private final AtomicReference<ScanReport> lastScanReport = new AtomicReference<>();

    public ScanService(HdlSourceParser sourceParser, SourcePreprocessor preprocessor, RuleService ruleService,
                       StatementChecker checker, SvDacProperties properties) {
        this.sourceParser = sourceParser;
        this.preprocessor = preprocessor;
        this.ruleService = ruleService;
        this.checker = checker;
        this.properties = properties;
    }

    /**
     * 扫描目录（递归）或单个文件
     */
    public ScanReport scan(String repoPath, ScanOptions options) {
        if (repoPath == null || repoPath.isBlank()) {
            throw new IllegalArgumentException("请提供扫描路径");
        }
        File root = new File(repoPath.trim());
        if (!root.exists()) {
            throw new IllegalArgumentException("路径不存在: " + repoPath);
        }
        Path rootPath = root.toPath().toAbsolutePath().normalize();
        log.info("开始扫描: {}", rootPath);

        List<File> sourceFiles = new ArrayList<>();
        if (root.isDirectory()) {
            findSourceFiles(root, sourceFiles, new HashSet<>());
        } else {
            sourceFiles.add(root);
        }
        log.info("找到 {} 个 HDL 源文件", sourceFiles.size());

        List<String> notices = new ArrayList<>();
        if (sourceFiles.isEmpty()) {
            notices.add("未发现 HDL 源文件，请确认路径正确，支持的扩展名: " + properties.getSourceExtensions());
        }

        ReportAccumulator acc = new ReportAccumulator(properties.getMaxViolations());
        for (File file : sourceFiles) {
            String displayName = root.isDirectory()
                    ? rootPath.relativize(file.toPath().toAbsolutePath().normalize()).toString()
                    : file.getName();
            String content;
            try {
                var decoded = TextDecodingUtils.decodeBestEffort(Files.readAllBytes(file.toPath()));
                content = decoded.text();
                Optional.ofNullable(decoded.buildNotice(displayName)).ifPresent(notices::add);
            } catch (IOException e) {
                log.warn("无法读取文件，已跳过: {}", file.getAbsolutePath(), e);
                notices.add("无法读取文件，已跳过: " + displayName);
                continue;
            }
            FileCheckResult result = checkFile(content, displayName, options, ScanListener.NONE);
            acc.add(result);
            if (result.stoppedEarly()) {
                break;
            }
        }

        return acc.build(rootPath.toString(), notices);
    }

    /**
     * 检查上传的单个文件内容
     */
    public ScanReport scanContent(String content, String fileName, ScanOptions options, List<String> initialNotices) {
        log.info("开始检查文件: {}", fileName);
        List<String> notices = new ArrayList<>();
        if (initialNotices != null) {
            notices.addAll(initialNotices);
        }
        ReportAccumulator acc = new ReportAccumulator(properties.getMaxViolations());
        acc.add(checkFile(content, fileName, options, ScanListener.NONE));
        return acc.build(fileName, notices);
    }

    /**
     * 检查一个文件的完整流程
     *
     * @param content  文件原始内容
     * @param fileName 文件名（用于报告）
     * @param options  扫描开关
     * @param listener 规则编译完成、发现违规时的回调
     * @return 文件检查结果
     */
    public FileCheckResult checkFile(String content, String fileName, ScanOptions options, ScanListener listener) {
        List<DacRule> rules = ruleService.rulesFor(content);
        listener.rulesCompiled(fileName, rules);

        String filtered = content;
        for (String tag : ignoreTags(rules)) {
            filtered = preprocessor.blankIgnoredLines(filtered, tag);
        }
        List<String> exceptions = ruleService.exceptionsFor(filtered);
        List<FlatStatement> statements = sourceParser.parse(filtered, fileName);

        CheckContext context = CheckContext.builder()
                .fileName(fileName)
                .exceptions(exceptions)
                .verbose(options.verbose())
                .stopOnFirst(options.stopOnFirst())
                .violationListener(listener::violationFound)
                .build();

        int passes = 0;
        List<Violation> violations = new ArrayList<>();
        try {
            for (FlatStatement statement : statements) {
                for (DacRule rule : rules) {
                    CheckResult result = checker.check(statement, rule, context);
                    passes += result.passes();
                    violations.addAll(result.violations());
                }
            }
        } catch (StopOnFirstViolationException e) {
            violations.add(e.getViolation());
            log.warn("{} 第 {} 行出现违规，按要求停止检查", fileName, e.getViolation().getLineNumber());
            return new FileCheckResult(fileName, rules, statements.size(), passes, violations, true);
        }

        log.info("{}: {} 次检查通过, {} 条违规", fileName, passes, violations.size());
        return new FileCheckResult(fileName, rules, statements.size(), passes, violations, false);
    }

    public void cacheLastScanReport(ScanReport report) {
        lastScanReport.set(report);
    }

    public Optional<ScanReport> getLastScanReport() {
        return Optional.ofNullable(lastScanReport.get());
    }

    private static Set<String> ignoreTags(List<DacRule> rules) {
        Set<String> tags = new LinkedHashSet<>();
        for (DacRule rule : rules) {
            if (rule.getIgnore() != null && !rule.getIgnore().isBlank()) {
                tags.add(rule.getIgnore());
            }
        }
        return tags;
    }

    /**
     * 递归查找 HDL 源文件
     */
    private void findSourceFiles(File dir, List<File> result, Set<Path> visitedDirs) {
        try {
            Path dirPath = dir.toPath();
            if (Files.isSymbolicLink(dirPath)) {
                log.info("跳过符号链接目录: {}", dir.getAbsolutePath());
                return;
            }
            if (!visitedDirs.add(dirPath.toRealPath())) {
                return;
            }
        } catch (IOException e) {
            log.warn("无法访问目录，已跳过: {}", dir.getAbsolutePath(), e);
            return;
        }

        File[] files = dir.listFiles();
        if (files == null)
            return;
        Arrays.sort(files);

        for (File file : files) {
            if (file.isDirectory()) {
                if (!properties.getExcludedDirs().contains(file.getName())) {
                    findSourceFiles(file, result, visitedDirs);
                }
            } else if (Files.isSymbolicLink(file.toPath())) {
                log.info("跳过符号链接文件: {}", file.getAbsolutePath());
            } else if (properties.isSourceFile(file.getName())) {
                result.add(file);
            }
        }
    }

    /**
     * 汇总多个文件的检查结果，超过上限的违规只计数不保存
     */
    private static final class ReportAccumulator {

        private final int maxViolations;
        private final List<Violation> violations = new ArrayList<>();
        private final List<String> scannedFiles = new ArrayList<>();
        private int statements;
        private int passes;
        private int violationCount;
        private boolean limitReached;
        private boolean stoppedEarly;

        ReportAccumulator(int maxViolations) {
            this.maxViolations = maxViolations;
        }

        void add(FileCheckResult result) {
            scannedFiles.add(result.fileName());
            statements += result.statements();
            passes += result.passes();
            violationCount += result.violations().size();
            stoppedEarly |= result.stoppedEarly();
            for (Violation v : result.violations()) {
                if (violations.size() >= maxViolations) {
                    limitReached = true;
                    break;
                }
                violations.add(v);
            }
        }

        ScanReport build(String repoPath, List<String> notices) {
            if (limitReached) {
                log.warn("违规数量达到上限 {}，报告只保留前 {} 条", maxViolations, maxViolations);
            }
            return ScanReport.builder()
                    .repoPath(repoPath)
                    .scanTime(LocalDateTime.now())
                    .totalFiles(scannedFiles.size())
                    .totalStatements(statements)
                    .totalPasses(passes)
                    .totalViolations(violationCount)
                    .violations(List.copyOf(violations))
                    .scannedFiles(List.copyOf(scannedFiles))
                    .notices(List.copyOf(notices))
                    .limitReached(limitReached)
                    .stoppedEarly(stoppedEarly)
                    .build();
        }
    }
}
