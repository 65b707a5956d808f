package report;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import com.alibaba.fastjson2.JSON;
import com.alibaba.fastjson2.JSONArray;
import com.alibaba.fastjson2.JSONObject;

import catalog.Service;
import catalog.Transaction;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ResultExporterTest {

    @Test
    void export_writes_service_and_transactions(@TempDir Path dir) throws IOException {
        Path out = dir.resolve("dumps/activity.json");
        Service service = new Service(1, "activity", "android.app.IActivityManager");

        ResultExporter.export(out, service, List.of(
                new Transaction(3, "startActivity", "Landroid/content/Intent;I", "I"),
                new Transaction(2, "getTasks", "", "Ljava/util/List;")));

        JSONObject json = JSON.parseObject(Files.readString(out, StandardCharsets.UTF_8));
        assertThat(json.getString("service")).isEqualTo("activity");
        assertThat(json.getString("project")).isEqualTo("android.app.IActivityManager");
        JSONArray transactions = json.getJSONArray("transactions");
        assertThat(transactions).hasSize(2);
        assertThat(transactions.getJSONObject(0).getIntValue("number")).isEqualTo(3);
        assertThat(transactions.getJSONObject(0).getString("arguments")).isEqualTo("Landroid/content/Intent;I");
        assertThat(transactions.getJSONObject(1).getString("methodName")).isEqualTo("getTasks");
    }

    @Test
    void native_service_keeps_null_project() {
        String json = ResultExporter.toJson(new Service(4, "vold", null), List.of());

        JSONObject parsed = JSON.parseObject(json);
        assertThat(parsed.containsKey("project")).isTrue();
        assertThat(parsed.get("project")).isNull();
        assertThat(parsed.getJSONArray("transactions")).isEmpty();
    }
}
