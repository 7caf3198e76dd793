package com.svdac.cli;

import com.svdac.exception.SvDacException;
import com.svdac.model.ScanOptions;
import com.svdac.service.FileCheckResult;
import com.svdac.service.ScanService;
import com.svdac.util.TextDecodingUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.logging.LogLevel;
import org.springframework.boot.logging.LoggingSystem;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * 命令行检查：svdac [-1] [-v] [-r] FILE...
 * <p>
 * 退出码为违规总数（最大 255）；"-1" 停止时为 1；致命错误为 2。
 */
@Command(
        name = "svdac",
        description = "检查 Verilog/SystemVerilog 赋值是否满足域命名规则",
        mixinStandardHelpOptions = true,
        version = "svdac 1.0.0"
)
public class SvDacCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(SvDacCommand.class);

    static final int EXIT_STOPPED = 1;
    static final int EXIT_FATAL = 2;
    static final int MAX_EXIT_CODE = 255;

    @Option(names = {"-1", "--one"}, description = "遇到第一个违规即退出")
    boolean one;

    @Option(names = {"-v", "--verbose"}, description = "输出变量被跳过的原因")
    boolean verbose;

    @Option(names = {"-r", "--rules"}, description = "打印每个文件使用的规则")
    boolean rules;

    @Parameters(arity = "1..*", paramLabel = "FILE", description = "要检查的源文件")
    List<Path> files;

    private final ScanService scanService;
    private final LoggingSystem loggingSystem;
    private final PrintStream out;
    private final PrintStream err;
    private final ConsoleStyle style;

    public SvDacCommand(ScanService scanService, LoggingSystem loggingSystem,
                        PrintStream out, PrintStream err, ConsoleStyle style) {
        this.scanService = scanService;
        this.loggingSystem = loggingSystem;
        this.out = out;
        this.err = err;
        this.style = style;
    }

    @Override
    public Integer call() {
        if (verbose && loggingSystem != null) {
            loggingSystem.setLogLevel("com.svdac", LogLevel.INFO);
        }
        ScanOptions options = new ScanOptions(one, verbose);
        ConsoleScanListener listener = new ConsoleScanListener(out, style, rules);

        int passes = 0;
        int violations = 0;
        for (Path file : files) {
            try {
                String content = TextDecodingUtils.decodeBestEffort(Files.readAllBytes(file)).text();
                FileCheckResult result = scanService.checkFile(content, file.toString(), options, listener);
                passes += result.passes();
                violations += result.violations().size();
                if (result.stoppedEarly()) {
                    return EXIT_STOPPED;
                }
            } catch (IOException e) {
                log.debug("读取失败: {}", file, e);
                err.println("Cannot read " + file + ": " + e.getMessage());
                return EXIT_FATAL;
            } catch (SvDacException e) {
                err.println(file + ": " + e.getMessage());
                return EXIT_FATAL;
            }
        }

        out.println("Correct checks: " + passes + ", Rule violations: " + violations);
        return Math.min(violations, MAX_EXIT_CODE);
    }
}
