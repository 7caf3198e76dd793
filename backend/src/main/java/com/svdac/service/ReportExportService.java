package com.svdac.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.svdac.model.ScanReport;
import com.svdac.model.Violation;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 扫描报告导出服务
 */
@Service
public class ReportExportService {

    private static final DateTimeFormatter FILE_TS = DateTimeFormatter.ofPattern("yyyyMMdd-HHmmss");

    private final ObjectMapper objectMapper;

    public ReportExportService(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public ExportPayload exportMarkdown(ScanReport report) {
        String markdown = buildMarkdown(report);
        byte[] content = markdown.getBytes(StandardCharsets.UTF_8);
        return new ExportPayload(
                "svdac-report-" + formatFileTs(report.getScanTime()) + ".md",
                "text/markdown;charset=UTF-8",
                content);
    }

    public ExportPayload exportJson(ScanReport report) {
        try {
            byte[] content = objectMapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(report);
            return new ExportPayload(
                    "svdac-report-" + formatFileTs(report.getScanTime()) + ".json",
                    "application/json;charset=UTF-8",
                    content);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("JSON 导出失败: " + e.getMessage(), e);
        }
    }

    String buildMarkdown(ScanReport report) {
        StringBuilder md = new StringBuilder();
        md.append("# 域赋值检查报告\n\n");
        md.append("**扫描时间:** ").append(report.getScanTime() != null ? report.getScanTime() : LocalDateTime.now()).append("\n");
        md.append("**扫描范围:** `").append(escapeInlineCode(report.getRepoPath())).append("`\n\n");

        if (report.isStoppedEarly()) {
            md.append("> **提示：** 已在第一个违规处停止检查，结果不完整。\n\n");
        }
        if (report.isLimitReached()) {
            md.append("> **警告：扫描结果被截断**\n");
            md.append("> 违规数量超过上限，报告只保留前 ").append(sizeOf(report.getViolations()))
                    .append(" 条，统计数字仍为全部违规。\n\n");
        }

        md.append("## 统计摘要\n");
        md.append("- **扫描文件总数:** ").append(report.getTotalFiles()).append("\n");
        md.append("- **语句总数:** ").append(report.getTotalStatements()).append("\n");
        md.append("- **通过检查:** ").append(report.getTotalPasses()).append("\n");
        md.append("- **违规总数:** ").append(report.getTotalViolations()).append("\n\n");

        List<String> notices = report.getNotices() != null ? report.getNotices() : List.of();
        if (!notices.isEmpty()) {
            md.append("## 提示\n\n");
            notices.forEach(n -> md.append("- ").append(n).append("\n"));
            md.append("\n");
        }

        List<Violation> violations = report.getViolations() != null ? report.getViolations() : List.of();
        if (violations.isEmpty()) {
            md.append("**所有赋值均符合域规则**\n");
            return md.toString();
        }

        md.append("## 违规详情\n\n");
        for (Map.Entry<String, List<Violation>> entry : groupByFile(violations).entrySet()) {
            md.append("### `").append(escapeInlineCode(entry.getKey())).append("` (")
                    .append(entry.getValue().size()).append(" 项)\n\n");
            for (Violation v : entry.getValue()) {
                String rule = v.getRule() != null ? v.getRule().describe() : "未知规则";
                md.append("**规则** `").append(escapeInlineCode(rule)).append("`\n");
                md.append("- **位置:** 行 ").append(v.getLineNumber()).append("\n");
                md.append("- **违规变量:** `").append(escapeInlineCode(v.getOperand())).append("`\n");
                md.append("- **语句:** `").append(escapeInlineCode(v.getStatement())).append("`\n");
                if (v.getRule() != null && notBlank(v.getRule().getIgnore())) {
                    md.append("- **忽略方式:** 在该行注释中加入 `")
                            .append(escapeInlineCode(v.getRule().getIgnore())).append("`\n");
                }
                md.append("\n");
            }
        }

        List<String> files = report.getScannedFiles() != null ? report.getScannedFiles() : List.of();
        md.append("## 扫描文件列表\n\n");
        for (String file : files) {
            md.append("- `").append(escapeInlineCode(file)).append("`\n");
        }
        return md.toString();
    }

    private Map<String, List<Violation>> groupByFile(List<Violation> violations) {
        Map<String, List<Violation>> grouped = new LinkedHashMap<>();
        for (Violation v : violations) {
            String path = notBlank(v.getFileName()) ? v.getFileName() : "unknown";
            grouped.computeIfAbsent(path, k -> new ArrayList<>()).add(v);
        }
        return grouped;
    }

    private int sizeOf(List<?> list) {
        return list == null ? 0 : list.size();
    }

    private String escapeInlineCode(String text) {
        return (text == null ? "" : text).replace("`", "\\`");
    }

    private boolean notBlank(String text) {
        return text != null && !text.isBlank();
    }

    private String formatFileTs(LocalDateTime time) {
        LocalDateTime effective = time != null ? time : LocalDateTime.now();
        return effective.format(FILE_TS);
    }

    public record ExportPayload(String filename, String contentType, byte[] content) {
    }
}
