package vpnmanager.adapter.in.dto;

import java.time.Instant;

import vpnmanager.core.model.certificate.TransparencyLogEntry;

public record TransparencyEventDto(
        long sequence,
        String fingerprint,
        String event,
        String type,
        String subjectDn,
        String actor,
        Instant occurredAt) {

    public static TransparencyEventDto fromModel(TransparencyLogEntry model) {
        return new TransparencyEventDto(
                model.sequence(),
                model.fingerprint(),
                model.event().name(),
                model.certificateType().wireName(),
                model.subjectDn(),
                model.actor(),
                model.occurredAt());
    }
}
