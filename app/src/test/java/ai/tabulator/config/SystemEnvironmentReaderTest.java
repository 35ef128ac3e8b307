package ai.tabulator.config;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.Optional;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class SystemEnvironmentReaderTest {

    private static final String KEY = "TABULATOR_TEST_ONLY_SETTING";

    @AfterEach
    void clearProperty() {
        System.clearProperty(KEY);
    }

    @Test
    void fallsBackToSystemPropertyWhenVariableIsUnset() {
        System.setProperty(KEY, " 42 ");

        EnvironmentReader reader = new SystemEnvironmentReader();

        assertThat(reader.get(KEY)).hasValue(" 42 ");
        assertThat(reader.value(KEY)).hasValue("42");
    }

    @Test
    void reportsMissingKeyAsEmpty() {
        assertThat(new SystemEnvironmentReader().get(KEY)).isEmpty();
    }

    @Test
    void treatsBlankValuesAsAbsent() {
        EnvironmentReader blank = key -> Optional.of("   ");

        assertThat(blank.value("ANY")).isEmpty();
    }
}
