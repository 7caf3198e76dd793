package com.svdac;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * SV-DAC 域赋值检查服务
 * <p>
 * 命令行入口见 {@link com.svdac.cli.SvDacCli}。
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class SvDacApplication {

    public static void main(String[] args) {
        SpringApplication.run(SvDacApplication.class, args);
    }
}
