package report;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import catalog.Service;
import catalog.Transaction;
import device.SecurityContextLookup;
import device.ServiceContextsFile;
import module.ServiceDiff;
import module.TransactionChange;
import org.junit.jupiter.api.Test;

class CatalogPrinterTest {

    private final ByteArrayOutputStream buffer = new ByteArrayOutputStream();
    private final CatalogPrinter printer = new CatalogPrinter(new PrintStream(buffer, true, StandardCharsets.UTF_8),
            new ServiceContextsFile(Map.of("activity", "u:object_r:activity_service:s0")), "UNKNOWN");

    private final Service activity = new Service(1, "activity", "android.app.IActivityManager");
    private final Service mount = new Service(2, "mount", "android.os.storage.IStorageManager");

    private String output() {
        return buffer.toString(StandardCharsets.UTF_8);
    }

    @Test
    void modified_shows_new_and_old_signature() {
        ServiceDiff diff = new ServiceDiff(activity, false, List.of(TransactionChange.modified(
                new Transaction(3, "startActivity", "Intent,int", "int"),
                new Transaction(3, "startActivity", "Intent", "int"))));

        printer.printDiff(diff, DiffOptions.defaults());

        assertThat(output()).isEqualTo(String.join(System.lineSeparator(),
                "activity",
                "  [MODIFIED] 3 startActivity(Intent,int)int was (Intent)int",
                ""));
    }

    @Test
    void new_service_lists_transactions_like_new_transactions() {
        Transaction t = new Transaction(5, "mount", "String", "void");
        printer.printDiff(new ServiceDiff(mount, true, List.of(TransactionChange.added(t))), DiffOptions.defaults());
        printer.printDiff(new ServiceDiff(activity, false, List.of(TransactionChange.added(t))), DiffOptions.defaults());

        assertThat(output()).isEqualTo(String.join(System.lineSeparator(),
                "mount [NEW]",
                "  [NEW] 5 mount(String)void",
                "activity",
                "  [NEW] 5 mount(String)void",
                ""));
    }

    @Test
    void unchanged_service_prints_nothing() {
        printer.printDiff(new ServiceDiff(activity, false, List.of()), DiffOptions.defaults().showContext(true));

        assertThat(output()).isEmpty();
    }

    @Test
    void brief_mode_prints_names_and_tags() {
        ServiceDiff diff = new ServiceDiff(activity, false, List.of(
                TransactionChange.added(new Transaction(7, "killAll", "", "void")),
                TransactionChange.modified(new Transaction(3, "startActivity", "Intent,int", "int"),
                        new Transaction(3, "startActivity", "Intent", "int"))));

        printer.printDiff(diff, DiffOptions.defaults().brief(true));

        assertThat(output()).contains("  [NEW] killAll").contains("  [MODIFIED] startActivity")
                .doesNotContain("Intent");
    }

    @Test
    void missing_context_renders_unknown_marker() {
        printer.printDiff(new ServiceDiff(mount, true, List.of()), DiffOptions.defaults().showContext(true));

        assertThat(output()).startsWith("mount [NEW] (UNKNOWN)");
        assertThat(printer.contextOf("activity")).isEqualTo("u:object_r:activity_service:s0");
        assertThat(printer.contextOf("nothing")).isEqualTo("UNKNOWN");
    }

    @Test
    void empty_label_is_treated_as_unknown() {
        SecurityContextLookup blank = name -> Optional.of("");
        CatalogPrinter p = new CatalogPrinter(new PrintStream(buffer, true, StandardCharsets.UTF_8), blank, "?");

        assertThat(p.contextOf("activity")).isEqualTo("?");
    }

    @Test
    void list_marks_services_absent_from_baseline() {
        List<Service> services = List.of(activity, mount, new Service(3, "vold", null));

        printer.printList(services, DiffOptions.defaults(), Set.of("activity", "vold"));

        assertThat(output()).isEqualTo(String.join(System.lineSeparator(),
                "activity [android.app.IActivityManager]",
                "mount [android.os.storage.IStorageManager] [NEW]",
                "vold [-]",
                ""));
    }

    @Test
    void brief_list_without_baseline_prints_names_with_context() {
        printer.printList(List.of(activity, mount), DiffOptions.defaults().brief(true).showContext(true), null);

        assertThat(output()).isEqualTo(String.join(System.lineSeparator(),
                "activity (u:object_r:activity_service:s0)",
                "mount (UNKNOWN)",
                ""));
    }

    @Test
    void dump_prints_header_and_transactions() {
        printer.printDump(activity, List.of(new Transaction(2, "getTasks", "", "Ljava/util/List;")));

        assertThat(output()).isEqualTo(String.join(System.lineSeparator(),
                "activity [android.app.IActivityManager]",
                "  2 getTasks()Ljava/util/List;",
                ""));
    }
}
