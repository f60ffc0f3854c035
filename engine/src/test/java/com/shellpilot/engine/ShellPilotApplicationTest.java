package com.shellpilot.engine;

import com.shellpilot.engine.builtin.BuiltinRegistry;
import com.shellpilot.engine.context.ContextAssembler;
import com.shellpilot.engine.executor.CommandExecutor;
import com.shellpilot.engine.loop.AssistantGateway;
import com.shellpilot.engine.loop.ResolutionLoop;
import com.shellpilot.engine.loop.ShellRunner;
import com.shellpilot.engine.model.ContextBundle;
import com.shellpilot.engine.translate.TranslationGateway;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Context wiring only. The interactive runner is switched off in the test
 * application.yml so nothing reads standard input.
 */
@SpringBootTest
class ShellPilotApplicationTest {

    @Autowired
    ApplicationContext context;

    @Autowired
    BuiltinRegistry builtins;

    @Autowired
    AssistantGateway assistant;

    @Test
    void contextLoads_withEngineBeans() {
        assertThat(context.getBean(ResolutionLoop.class)).isNotNull();
        assertThat(context.getBean(CommandExecutor.class)).isNotNull();
        assertThat(context.getBean(ContextAssembler.class)).isNotNull();
        assertThat(context.getBean(TranslationGateway.class)).isNotNull();
    }

    @Test
    void interactiveRunner_disabledInTests() {
        assertThat(context.getBeansOfType(ShellRunner.class)).isEmpty();
    }

    @Test
    void everyBuiltinComponent_isRegistered() {
        assertThat(builtins.names()).containsExactly(
                "alias", "cd", "exit", "export", "history", "mode", "pwd", "unalias");
    }

    @Test
    void assistant_isThePlaceholder() {
        assertThat(assistant.handle("plan a refactor", ContextBundle.of("plan a refactor")))
                .startsWith("AI mode not yet implemented")
                .contains("Request: plan a refactor");
    }
}
