package com.svdac.config;

import com.svdac.model.DacRule;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * 检查器配置，前缀 svdac
 */
@Data
@ConfigurationProperties(prefix = "svdac")
public class SvDacProperties {

    /** 参与扫描的文件扩展名 */
    private List<String> sourceExtensions = new ArrayList<>(List.of(".v", ".sv", ".vh", ".svh"));

    /** 扫描目录时跳过的子目录 */
    private List<String> excludedDirs = new ArrayList<>(List.of(
            ".git", ".idea", ".vscode", "target", "build", "node_modules", "out"));

    /** 报告中保留的违规上限，超过后只计数不保存 */
    private int maxViolations = 1000;

    /** 内嵌规则未写 "--" 时使用的忽略标记 */
    private String defaultIgnoreTag = DacRule.DEFAULT_IGNORE_TAG;

    public boolean isSourceFile(String fileName) {
        String lower = fileName.toLowerCase();
        return sourceExtensions.stream().anyMatch(ext -> lower.endsWith(ext.toLowerCase()));
    }
}
