package com.svdac.cli;

import com.svdac.SvDacApplication;
import com.svdac.service.ScanService;
import org.springframework.boot.Banner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.builder.SpringApplicationBuilder;
import org.springframework.boot.logging.LoggingSystem;
import org.springframework.context.ConfigurableApplicationContext;
import picocli.CommandLine;

/**
 * 命令行入口：启动不带 Web 的 Spring 上下文，交给 picocli 解析参数
 */
public final class SvDacCli {

    private SvDacCli() {
    }

    public static void main(String[] args) {
        ConfigurableApplicationContext context = new SpringApplicationBuilder(SvDacApplication.class)
                .web(WebApplicationType.NONE)
                .bannerMode(Banner.Mode.OFF)
                .logStartupInfo(false)
                .properties("logging.level.root=WARN", "logging.level.com.svdac=WARN")
                .run();

        SvDacCommand command = new SvDacCommand(
                context.getBean(ScanService.class),
                LoggingSystem.get(SvDacCli.class.getClassLoader()),
                System.out,
                System.err,
                ConsoleStyle.fromEnvironment(System.getenv()));
        int exitCode = new CommandLine(command).execute(args);
        System.exit(SpringApplication.exit(context, () -> exitCode));
    }
}
