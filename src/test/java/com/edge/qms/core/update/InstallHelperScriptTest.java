package com.edge.qms.core.update;

import org.junit.jupiter.api.Test;

import java.nio.file.Paths;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class InstallHelperScriptTest {

    @Test
    void posixScriptWaitsForParentBeforeCopying() {
        InstallHelperScript script = new InstallHelperScript(PlatformFamily.LINUX, 4242,
                Paths.get("/tmp/QMS_Update.AppImage"), Paths.get("/opt/qms/qms.AppImage"),
                List.of("/opt/qms/qms.AppImage"), 500);

        String text = script.render();

        assertThat(script.fileName()).endsWith(".sh");
        assertThat(text).startsWith("#!/bin/sh");
        assertThat(text).contains("PARENT_PID=4242");
        assertThat(text).contains("kill -0 \"$PARENT_PID\"");
        assertThat(text).contains("sleep 0.500");
        assertThat(text.indexOf("done")).isLessThan(text.indexOf("cp -f"));
        assertThat(text).contains("cp -f '/tmp/QMS_Update.AppImage' '/opt/qms/qms.AppImage' || exit 1");
        assertThat(text).contains("nohup '/opt/qms/qms.AppImage'");
        assertThat(text).contains("rm -f '/tmp/QMS_Update.AppImage'");
        assertThat(text).contains("rm -f \"$0\"");
    }

    @Test
    void posixScriptWithoutRelaunch() {
        InstallHelperScript script = new InstallHelperScript(PlatformFamily.MACOS, 1,
                Paths.get("/tmp/a"), Paths.get("/tmp/b"), null, 250);

        assertThat(script.render()).doesNotContain("nohup").contains("sleep 0.250");
    }

    @Test
    void windowsScriptPollsTasklist() {
        InstallHelperScript script = new InstallHelperScript(PlatformFamily.WINDOWS, 777,
                Paths.get("QMS_Update.exe"), Paths.get("qms.exe"), List.of("qms.exe"), 500);

        String text = script.render();

        assertThat(script.fileName()).endsWith(".cmd");
        assertThat(text).contains("tasklist /FI \"PID eq 777\"");
        assertThat(text).contains("Start-Sleep -Milliseconds 500");
        assertThat(text.indexOf("goto wait")).isLessThan(text.indexOf("copy /Y"));
        assertThat(text).contains("if errorlevel 1 exit /b 1");
        assertThat(text).contains("start \"\" \"qms.exe\"");
        assertThat(text).contains("del \"%~f0\"");
    }

    @Test
    void singleQuotesAreEscapedForShell() {
        assertThat(InstallHelperScript.shQuote("/tmp/it's")).isEqualTo("'/tmp/it'\\''s'");
    }
}
