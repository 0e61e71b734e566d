package com.edge.qms.core.update;

import java.io.IOException;
import java.util.List;

/**
 * 启动与当前进程分离的外部进程
 */
public interface ProcessLauncher {
    void launchDetached(List<String> command) throws IOException;
}
