package io.classguard.web;

import io.classguard.ingest.aggregate.AggregateBucket;
import io.classguard.ingest.cache.StateSnapshot;
import io.classguard.ingest.report.Report;
import io.classguard.ingest.report.ReportRow;
import io.classguard.ingest.subscriber.IngestionStats;
import io.classguard.store.model.Channel;
import io.classguard.store.model.ControlCommand;
import io.classguard.store.model.Device;
import io.classguard.store.model.Reading;
import io.classguard.store.repository.ReadingPage;
import org.json.JSONArray;
import org.json.JSONObject;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * JSON bodies served by {@link DashboardWebServer}. Field names follow the
 * sensor-topic format so the dashboard can treat live and stored readings alike.
 */
final class JsonViews {

    private JsonViews() {
    }

    static JSONObject latest(StateSnapshot snapshot) {
        Reading reading = snapshot.getReading();
        return new JSONObject()
                .put("reading", reading.isEmpty() ? JSONObject.NULL : reading(reading))
                .put("devices", devices(snapshot.getDeviceStatus().asMap()));
    }

    static JSONObject reading(Reading reading) {
        JSONObject json = new JSONObject()
                .put("device_id", reading.getDeviceId());
        for (Channel channel : Channel.values()) {
            Double value = reading.get(channel);
            json.put(channel.key(), value == null ? JSONObject.NULL : value);
        }
        return json
                .put("class_score", reading.getScore())
                .put("status", reading.getStatus())
                .put("timestamp", instant(reading.getTimestamp()))
                .put("received_at", instant(reading.getReceivedAt()));
    }

    static JSONObject devices(Map<Device, Boolean> states) {
        JSONObject json = new JSONObject();
        states.forEach((device, on) -> json.put(device.wireName(), on.booleanValue()));
        return json;
    }

    static JSONObject history(ReadingPage page) {
        JSONArray items = new JSONArray();
        for (Reading reading : page.getItems()) {
            items.put(reading(reading));
        }
        return new JSONObject()
                .put("page", page.getPage())
                .put("pageSize", page.getPageSize())
                .put("totalItems", page.getTotalItems())
                .put("totalPages", page.totalPages())
                .put("items", items);
    }

    static JSONObject chart(List<AggregateBucket> buckets) {
        JSONArray series = new JSONArray();
        for (AggregateBucket bucket : buckets) {
            JSONObject json = new JSONObject()
                    .put("start", instant(bucket.getBucketStart()))
                    .put("end", instant(bucket.getBucketEnd()))
                    .put("count", bucket.getCount());
            for (Channel channel : Channel.values()) {
                Double mean = bucket.getMeans().get(channel);
                json.put(channel.key(), mean == null ? JSONObject.NULL : mean);
            }
            series.put(json);
        }
        return new JSONObject().put("buckets", series);
    }

    static JSONObject report(Report report) {
        JSONArray rows = new JSONArray();
        for (ReportRow row : report.getRows()) {
            rows.put(new JSONArray(row.getCells()));
        }
        return new JSONObject()
                .put("generatedAt", instant(report.getGeneratedAt()))
                .put("since", instant(report.getSince()))
                .put("until", instant(report.getUntil()))
                .put("truncated", report.isTruncated())
                .put("headers", new JSONArray(report.getHeaders()))
                .put("rows", rows);
    }

    static JSONArray commands(List<ControlCommand> commands) {
        JSONArray array = new JSONArray();
        for (ControlCommand command : commands) {
            array.put(new JSONObject()
                    .put("id", command.getId())
                    .put("device", command.getDevice().wireName())
                    .put("state", command.getState())
                    .put("issuedBy", command.getIssuedBy())
                    .put("issuedAt", instant(command.getIssuedAt())));
        }
        return array;
    }

    static JSONObject ingestion(String state, IngestionStats stats) {
        return new JSONObject()
                .put("state", state)
                .put("received", stats.getReceived())
                .put("stored", stats.getStored())
                .put("decodeFailures", stats.getDecodeFailures())
                .put("droppedReadings", stats.getDroppedReadings())
                .put("rejectedReadings", stats.getRejectedReadings())
                .put("acknowledgements", stats.getAcknowledgements())
                .put("connectAttempts", stats.getConnectAttempts())
                .put("connectionsLost", stats.getConnectionsLost());
    }

    static JSONObject error(String message) {
        return new JSONObject().put("error", message);
    }

    private static Object instant(Instant instant) {
        return instant == null ? JSONObject.NULL : instant.toString();
    }
}
