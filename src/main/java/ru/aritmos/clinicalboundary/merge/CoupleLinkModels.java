package ru.aritmos.clinicalboundary.merge;

import io.swagger.v3.oas.annotations.media.Schema;

import java.time.Instant;

/**
 * Связка пары: два клиента одного терапевта. Только она разрешает слияние.
 */
public final class CoupleLinkModels {

    private CoupleLinkModels() {
        // утилитарный класс
    }

    public enum CoupleLinkStatus {
        ACTIVE,
        PAUSED,
        TERMINATED
    }

    @Schema(description = "Связка пары. Партнёры хранятся в каноническом порядке (partnerAId < partnerBId).")
    public record CoupleLink(
            String id,
            String partnerAId,
            String partnerBId,
            String therapistId,
            CoupleLinkStatus status,
            Instant createdAt,
            Instant updatedAt,
            @Schema(description = "Заметки терапевта. В аудит и логи не попадают.")
            String notes
    ) {
        public CoupleLink {
            if (partnerAId != null && partnerBId != null && partnerAId.compareTo(partnerBId) > 0) {
                String t = partnerAId;
                partnerAId = partnerBId;
                partnerBId = t;
            }
            status = status == null ? CoupleLinkStatus.ACTIVE : status;
        }

        public boolean isActive() {
            return status == CoupleLinkStatus.ACTIVE;
        }

        public boolean involves(String clientId) {
            return clientId != null && (clientId.equals(partnerAId) || clientId.equals(partnerBId));
        }

        public CoupleLink withStatus(CoupleLinkStatus newStatus, Instant now) {
            return new CoupleLink(id, partnerAId, partnerBId, therapistId, newStatus, createdAt, now, notes);
        }
    }
}
