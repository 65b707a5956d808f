package extract;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;

import org.junit.jupiter.api.Test;

class MethodBlockScannerTest {

    private final MethodBlockScanner scanner = new MethodBlockScanner(".prologue");
    private final ParameterAnnotationScanner params = new ParameterAnnotationScanner();

    private static final List<String> PROXY = List.of(
            ".method public asBinder()Landroid/os/IBinder;",
            "    .registers 2",
            "    .prologue",
            "    return-object v0",
            ".end method",
            "",
            ".method public startActivityAsUser(Landroid/content/Intent;II)I",
            "    .registers 9",
            "    .prologue",
            ".end method",
            "",
            ".method public startActivity(Landroid/content/Intent;I)I",
            "    .registers 8",
            "    .param p1, \"intent\"    # Landroid/content/Intent;",
            "    .param p2, \"flags\"    # I",
            "",
            "    .prologue",
            "    return v2",
            ".end method",
            "",
            ".method private hidden(I)V",
            "    .prologue",
            ".end method");

    @Test
    void block_spans_declaration_through_prologue() {
        MethodBlock block = scanner.find(PROXY, "startActivity");

        assertThat(block).isNotNull();
        assertThat(block.getDeclaration()).isEqualTo(".method public startActivity(Landroid/content/Intent;I)I");
        assertThat(block.getLines()).last().isEqualTo(".prologue");
        assertThat(block.getStartLine()).isEqualTo(12);
    }

    @Test
    void name_must_match_exactly() {
        MethodBlock block = scanner.find(PROXY, "startActivityAsUser");

        assertThat(block.getDeclaration()).contains("startActivityAsUser(");
        assertThat(scanner.find(PROXY, "startActivityAs")).isNull();
    }

    @Test
    void non_public_and_missing_methods_have_no_block() {
        assertThat(scanner.find(PROXY, "hidden")).isNull();
        assertThat(scanner.find(PROXY, "foo")).isNull();
    }

    @Test
    void no_block_without_prologue_marker() {
        List<String> lines = List.of(
                ".method public foo(I)V",
                "    .registers 3",
                "    return-void",
                ".end method");

        assertThat(scanner.find(lines, "foo")).isNull();
    }

    @Test
    void signature_splits_at_closing_parenthesis() {
        MethodSignature signature = MethodBlockScanner.parseSignature(scanner.find(PROXY, "startActivity"), params);

        assertThat(signature.getArguments()).isEqualTo("Landroid/content/Intent;I");
        assertThat(signature.getReturns()).isEqualTo("I");
        assertThat(signature.getParameterNames()).containsExactly("intent", "flags");
    }

    @Test
    void empty_parameter_list_skips_annotation_scan() {
        MethodSignature signature = MethodBlockScanner.parseSignature(scanner.find(PROXY, "asBinder"), params);

        assertThat(signature.getArguments()).isEmpty();
        assertThat(signature.getReturns()).isEqualTo("Landroid/os/IBinder;");
        assertThat(signature.getParameterNames()).isEmpty();
    }

    @Test
    void unterminated_parameter_list_is_rejected() {
        MethodBlock block = new MethodBlock("foo", List.of(".method public foo(I", ".prologue"), 1);

        assertThatThrownBy(() -> MethodBlockScanner.parseSignature(block, params))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void parameter_scan_stops_at_end_of_method() {
        List<String> names = params.scan(List.of(
                ".param p1, \"first\"    # I",
                ".end method",
                ".param p1, \"other\"    # I"));

        assertThat(names).containsExactly("first");
    }
}
