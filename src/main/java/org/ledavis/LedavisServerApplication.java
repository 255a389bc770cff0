package org.ledavis;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * MCP Server 入口（STDIO 传输；标准输出归协议使用，日志只写文件）。
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class LedavisServerApplication {

    public static void main(String[] args) {
        ensureLogDirectory();
        SpringApplication.run(LedavisServerApplication.class, args);
    }

    /**
     * 提前创建日志目录，避免 RollingFileAppender 因目录不存在而初始化失败。
     * <p>
     * 规则与 logback-spring.xml 一致：系统属性 LOG_PATH，其次环境变量 LOG_PATH，默认 ./logs
     */
    static Path ensureLogDirectory() {
        String logPath = System.getProperty("LOG_PATH");
        if (logPath == null || logPath.isBlank()) {
            logPath = System.getenv("LOG_PATH");
        }
        if (logPath == null || logPath.isBlank()) {
            logPath = "logs";
        }
        Path directory = Path.of(logPath);
        try {
            Files.createDirectories(directory);
        } catch (IOException e) {
            // 日志系统尚未初始化，只能写 stderr（stdout 属于 MCP 协议）
            System.err.println("无法创建日志目录 " + directory + "：" + e.getMessage());
        }
        return directory;
    }
}
