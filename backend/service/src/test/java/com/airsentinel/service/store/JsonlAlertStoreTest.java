package com.airsentinel.service.store;

import com.airsentinel.core.model.AlertRecord;
import com.airsentinel.core.model.AlertType;
import com.airsentinel.core.model.Severity;
import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class JsonlAlertStoreTest {
    @Test
    void resolutionIsAppendedAndSupersedesRaisedState() throws Exception {
        Path file = Files.createTempDirectory("alert-store").resolve("alerts.jsonl");
        JsonlAlertStore store = new JsonlAlertStore(file);
        AlertRecord high = alert("a-1", AlertType.HIGH_CO2);
        AlertRecord risk = alert("a-2", AlertType.CRITICAL_RISK);

        store.append(high);
        store.append(risk);
        store.append(high.resolve(2000.0));

        List<AlertRecord> history = store.history();
        assertEquals(3, history.size());
        assertEquals(2, store.all().size());
        List<AlertRecord> active = store.active();
        assertEquals(1, active.size());
        assertEquals("a-2", active.get(0).id());
        AlertRecord resolved = store.all().stream().filter(a -> a.id().equals("a-1")).findFirst().orElseThrow();
        assertTrue(resolved.resolved());
        assertEquals(2000.0, resolved.resolvedAt(), 1e-9);
    }

    @Test
    void missingFileMeansNoAlerts() throws Exception {
        JsonlAlertStore store = new JsonlAlertStore(Files.createTempDirectory("alert-store").resolve("alerts.jsonl"));

        assertTrue(store.history().isEmpty());
        assertTrue(store.active().isEmpty());
    }

    private static AlertRecord alert(String id, AlertType type) {
        return new AlertRecord(id, type, "sensor-1", Severity.WARNING, "CO2 high", false, 1000.0, null);
    }
}
