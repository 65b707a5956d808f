package main;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class MainTest {

    @Test
    void baseline_flag_without_path_is_a_configuration_error() {
        assertThat(Main.run(new String[]{"list", "--baseline"})).isEqualTo(BinderCatalog.CODE_CONFIG_ERROR);
    }

    @Test
    void missing_or_unknown_operation_is_a_configuration_error() {
        assertThat(Main.run(new String[]{"-b"})).isEqualTo(BinderCatalog.CODE_CONFIG_ERROR);
        assertThat(Main.run(new String[]{"rebuild"})).isEqualTo(BinderCatalog.CODE_CONFIG_ERROR);
    }

    @Test
    void dump_without_service_is_a_configuration_error() {
        assertThat(Main.run(new String[]{"dump"})).isEqualTo(BinderCatalog.CODE_CONFIG_ERROR);
    }
}
