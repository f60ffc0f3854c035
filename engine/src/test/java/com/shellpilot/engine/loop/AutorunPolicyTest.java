package com.shellpilot.engine.loop;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class AutorunPolicyTest {

    @TempDir
    Path cwd;

    @ParameterizedTest
    @ValueSource(strings = {"ls -la", "git status", "cat README.md", "PWD", "tail -f app.log"})
    void safePrefix_runs(String command) {
        assertThat(AutorunPolicy.shouldAutorun(command, cwd)).isTrue();
    }

    @ParameterizedTest
    @ValueSource(strings = {"rm -rf build", "sudo systemctl restart nginx", "git push origin main", "npm install"})
    void riskyKeyword_waits(String command) {
        assertThat(AutorunPolicy.shouldAutorun(command, cwd)).isFalse();
    }

    @Test
    void unknownCommand_waits() {
        assertThat(AutorunPolicy.shouldAutorun("make release", cwd)).isFalse();
    }

    @Test
    void pythonScript_runsOnlyWhenScriptExists() throws IOException {
        assertThat(AutorunPolicy.shouldAutorun("python report.py", cwd)).isFalse();

        Files.writeString(cwd.resolve("report.py"), "print('hi')");

        assertThat(AutorunPolicy.shouldAutorun("python report.py --fast", cwd)).isTrue();
    }
}
