package site.redisclone.server.config;

import org.junit.jupiter.api.Test;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RedisServerConfigTest {

    @Test
    void testDefaults() {
        final RedisServerConfig config = RedisServerConfig.defaultConfig();

        assertThat(config.getHost()).isEqualTo("0.0.0.0");
        assertThat(config.getPort()).isEqualTo(2000);
        assertThat(config.getBacklogSize()).isEqualTo(511);
        assertThat(config.getReadBufferSize()).isEqualTo(1024);
        assertThat(config.getHz()).isEqualTo(10);
        assertThat(config.getActiveExpireLookups()).isEqualTo(20);
        assertThat(config.isDebug()).isFalse();
        assertThat(config.cronIntervalMillis()).isEqualTo(100);
    }

    @Test
    void testFromEnvironment() {
        final Map<String, String> env = new HashMap<>();
        env.put(RedisServerConfig.ENV_DEBUG, "1");
        env.put(RedisServerConfig.ENV_PORT, " 7000 ");

        final RedisServerConfig config = RedisServerConfig.fromEnvironment(env);

        assertThat(config.isDebug()).isTrue();
        assertThat(config.getPort()).isEqualTo(7000);
    }

    @Test
    void testFromEmptyEnvironment() {
        final RedisServerConfig config = RedisServerConfig.fromEnvironment(Collections.emptyMap());

        assertThat(config.isDebug()).isFalse();
        assertThat(config.getPort()).isEqualTo(2000);
    }

    @Test
    void testEmptyDebugValueDisablesDebug() {
        final RedisServerConfig config = RedisServerConfig.fromEnvironment(
                Collections.singletonMap(RedisServerConfig.ENV_DEBUG, ""));

        assertThat(config.isDebug()).isFalse();
    }

    @Test
    void testInvalidPort() {
        assertThatThrownBy(() -> RedisServerConfig.fromEnvironment(
                Collections.singletonMap(RedisServerConfig.ENV_PORT, "abc")))
                .isInstanceOf(IllegalArgumentException.class);

        assertThatThrownBy(() -> RedisServerConfig.builder().port(70000).build().validate())
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void testValidate() {
        RedisServerConfig.defaultConfig().validate();

        assertThatThrownBy(() -> RedisServerConfig.builder().hz(0).build().validate())
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> RedisServerConfig.builder().readBufferSize(0).build().validate())
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> RedisServerConfig.builder().activeExpireLookups(0).build().validate())
                .isInstanceOf(IllegalArgumentException.class);
    }
}
