package report;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import com.alibaba.fastjson2.JSON;
import com.alibaba.fastjson2.JSONWriter;

import catalog.Service;
import catalog.Transaction;
import utils.Log;

/**
 * JSON dump of one service's transaction table.
 */
public class ResultExporter {

    public static String toJson(Service service, List<Transaction> transactions) {
        return JSON.toJSONString(new ServiceOutput(service, transactions),
                JSONWriter.Feature.PrettyFormat, JSONWriter.Feature.WriteNulls);
    }

    public static void export(Path outputPath, Service service, List<Transaction> transactions) throws IOException {
        Path parentDir = outputPath.toAbsolutePath().getParent();
        if (parentDir != null && !Files.isDirectory(parentDir)) {
            Files.createDirectories(parentDir);
        }
        try (BufferedWriter writer = Files.newBufferedWriter(outputPath, StandardCharsets.UTF_8)) {
            writer.write(toJson(service, transactions));
            writer.newLine();
        }
        Log.info("[+] Exported " + service.getName() + " to " + outputPath);
    }

    public static class ServiceOutput {
        private final String service;
        private final String project;
        private final List<TransactionOutput> transactions = new ArrayList<>();

        public ServiceOutput(Service service, List<Transaction> transactions) {
            this.service = service.getName();
            this.project = service.getProject();
            for (Transaction t : transactions) {
                this.transactions.add(new TransactionOutput(t));
            }
        }

        public String getService() {
            return service;
        }

        public String getProject() {
            return project;
        }

        public List<TransactionOutput> getTransactions() {
            return transactions;
        }
    }

    public static class TransactionOutput {
        private final int number;
        private final String methodName;
        private final String arguments;
        private final String returns;

        public TransactionOutput(Transaction t) {
            this.number = t.getNumber();
            this.methodName = t.getMethodName();
            this.arguments = t.getArguments();
            this.returns = t.getReturns();
        }

        public int getNumber() {
            return number;
        }

        public String getMethodName() {
            return methodName;
        }

        public String getArguments() {
            return arguments;
        }

        public String getReturns() {
            return returns;
        }
    }
}
