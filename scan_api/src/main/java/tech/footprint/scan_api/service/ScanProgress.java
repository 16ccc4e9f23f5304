package tech.footprint.scan_api.service;

import reactor.core.publisher.FluxSink;
import tech.footprint.scan_api.model.ChainEvent;
import tech.footprint.scan_api.model.ChainEventStatus;
import tech.footprint.scan_api.model.ScanMessage;
import tech.footprint.scan_api.model.ScanResult;
import tech.footprint.scan_api.model.ScanStage;

import java.time.Clock;
import java.util.Map;

/**
 * Writes the progress events of one scan. All events of a stage share one id, so a later event
 * replaces the earlier one on the client.
 */
class ScanProgress {

    static final String SYSTEM_MODULE = "system";

    private final String scanId;
    private final FluxSink<ScanMessage> sink;
    private final Clock clock;

    ScanProgress(String scanId, FluxSink<ScanMessage> sink, Clock clock) {
        this.scanId = scanId;
        this.sink = sink;
        this.clock = clock;
    }

    void processing(ScanStage stage, String message) {
        emit(stage.module(), message, ChainEventStatus.PROCESSING, null);
    }

    void processing(ScanStage stage, String message, Map<String, Object> details) {
        emit(stage.module(), message, ChainEventStatus.PROCESSING, details);
    }

    void complete(ScanStage stage, String message, Map<String, Object> details) {
        emit(stage.module(), message, ChainEventStatus.COMPLETE, details);
    }

    void skipped(ScanStage stage, String message) {
        emit(stage.module(), message, ChainEventStatus.SKIPPED, null);
    }

    void error(ScanStage stage, String message) {
        emit(stage.module(), message, ChainEventStatus.ERROR, null);
    }

    void systemError(String message, Map<String, Object> details) {
        emit(SYSTEM_MODULE, message, ChainEventStatus.ERROR, details);
    }

    void result(ScanResult result) {
        sink.next(ScanMessage.result(result));
    }

    String eventId(String module) {
        return scanId + ":" + module;
    }

    private void emit(String module, String message, ChainEventStatus status, Map<String, Object> details) {
        sink.next(ScanMessage.event(new ChainEvent(eventId(module), module, message, status, clock.instant(), details)));
    }
}
