package dev.lyceum;

import dev.lyceum.answer.AnswerStreamer;
import dev.lyceum.answer.TextGenerator;
import dev.lyceum.mcp.McpToolService;
import dev.lyceum.search.RetrievalPipeline;
import dev.lyceum.search.VectorRetriever;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.ApplicationContext;

import static org.assertj.core.api.Assertions.assertThat;

class SmokeIT extends BaseIntegrationTest {

    @Autowired
    private ApplicationContext context;

    @Test
    void contextLoadsWithoutLlmCredentials() {
        assertThat(context.getBean(RetrievalPipeline.class)).isNotNull();
        assertThat(context.getBean(AnswerStreamer.class)).isNotNull();
        assertThat(context.getBean(McpToolService.class)).isNotNull();
        assertThat(context.getBean(VectorRetriever.class)).isNotNull();
        assertThat(context.getBeanNamesForType(TextGenerator.class)).isEmpty();
    }
}
