package com.duoim.config;

import org.junit.jupiter.api.Test;
import org.springframework.boot.env.YamlPropertySourceLoader;
import org.springframework.core.env.PropertySource;
import org.springframework.core.io.ClassPathResource;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;

class ApplicationYamlParseTest {

    @Test
    void applicationYaml_ShouldBeParsable() throws Exception {
        var loader = new YamlPropertySourceLoader();
        List<PropertySource<?>> sources = loader.load("application", new ClassPathResource("application.yml"));
        assertNotNull(sources);
        assertFalse(sources.isEmpty());

        PropertySource<?> src = sources.get(0);
        assertThat(String.valueOf(src.getProperty("im.typing.idle-timeout-ms"))).isEqualTo("2000");
        assertThat(String.valueOf(src.getProperty("im.chat.write.lock-timeout-ms"))).isEqualTo("3000");
        assertThat(String.valueOf(src.getProperty("im.chat.message.max-text-length"))).isEqualTo("4096");
        assertThat(String.valueOf(src.getProperty("im.auth.user-id-header"))).isEqualTo("X-User-Id");
    }

    @Test
    void testProfileYaml_ShouldDisableGateway() throws Exception {
        var loader = new YamlPropertySourceLoader();
        List<PropertySource<?>> sources = loader.load("application-test", new ClassPathResource("application-test.yml"));
        assertThat(String.valueOf(sources.get(0).getProperty("im.gateway.ws.enabled"))).isEqualTo("false");
    }
}
