package com.edge.qms.core.update;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.List;

/**
 * 基于 ProcessBuilder 的实现，子进程输出丢弃，不等待其结束
 */
public class DefaultProcessLauncher implements ProcessLauncher {
    private static final Logger logger = LoggerFactory.getLogger(DefaultProcessLauncher.class);

    @Override
    public void launchDetached(List<String> command) throws IOException {
        ProcessBuilder builder = new ProcessBuilder(command)
                .redirectOutput(ProcessBuilder.Redirect.DISCARD)
                .redirectError(ProcessBuilder.Redirect.DISCARD);
        Process process = builder.start();
        logger.info("Launched helper process {}: {}", process.pid(), command);
    }
}
