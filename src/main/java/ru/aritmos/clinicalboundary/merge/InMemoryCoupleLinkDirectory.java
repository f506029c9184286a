package ru.aritmos.clinicalboundary.merge;

import io.micronaut.context.annotation.Secondary;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Справочник связок пар в памяти процесса.
 * <p>
 * Используется по умолчанию, пока не подключено персистентное хранилище. Идентификаторы клиентов,
 * терапевтов и связок должны быть UUID.
 */
@Singleton
@Secondary
public class InMemoryCoupleLinkDirectory implements CoupleLinkDirectory {

    private static final Logger log = LoggerFactory.getLogger(InMemoryCoupleLinkDirectory.class);

    private final Map<String, CoupleLinkModels.CoupleLink> links = new ConcurrentHashMap<>();
    private final Map<String, String> clientTherapists = new ConcurrentHashMap<>();

    /**
     * Зарегистрировать клиента за терапевтом. Используется при проверке создания связки.
     */
    public void registerClient(String clientId, String therapistId) {
        requireUuid(clientId, "clientId");
        requireUuid(therapistId, "therapistId");
        clientTherapists.put(clientId, therapistId);
    }

    /**
     * Создать связку пары.
     *
     * @throws CoupleLinkException INVALID при некорректных идентификаторах, совпадающих партнёрах,
     *                             чужом клиенте или уже существующей связке
     */
    public CoupleLinkModels.CoupleLink createLink(String partnerAId, String partnerBId, String therapistId, String notes) {
        requireUuid(partnerAId, "partnerAId");
        requireUuid(partnerBId, "partnerBId");
        requireUuid(therapistId, "therapistId");
        if (partnerAId.equals(partnerBId)) {
            throw new CoupleLinkException(CoupleLinkException.Reason.INVALID, "Cannot link a client to themselves");
        }
        requireClientOf(partnerAId, therapistId, "Partner A");
        requireClientOf(partnerBId, therapistId, "Partner B");

        synchronized (links) {
            Optional<CoupleLinkModels.CoupleLink> existing = findLink(partnerAId, partnerBId);
            if (existing.isPresent()) {
                throw new CoupleLinkException(CoupleLinkException.Reason.INVALID,
                        "Link already exists: " + existing.get().id());
            }
            Instant now = Instant.now();
            CoupleLinkModels.CoupleLink link = new CoupleLinkModels.CoupleLink(
                    UUID.randomUUID().toString(), partnerAId, partnerBId, therapistId,
                    CoupleLinkModels.CoupleLinkStatus.ACTIVE, now, now, notes);
            links.put(link.id(), link);
            log.info("[MERGE] создана связка пары linkId={} therapistId={}", link.id(), therapistId);
            return link;
        }
    }

    @Override
    public CoupleLinkModels.CoupleLink getLink(String linkId) {
        if (linkId == null || linkId.isBlank()) {
            throw new CoupleLinkException(CoupleLinkException.Reason.INVALID, "Link id is empty");
        }
        CoupleLinkModels.CoupleLink link = links.get(linkId);
        if (link == null) {
            throw new CoupleLinkException(CoupleLinkException.Reason.NOT_FOUND, "Link not found: " + linkId);
        }
        return link;
    }

    /**
     * Найти связку двух клиентов независимо от порядка аргументов.
     */
    public Optional<CoupleLinkModels.CoupleLink> findLink(String partnerAId, String partnerBId) {
        if (partnerAId == null || partnerBId == null) {
            return Optional.empty();
        }
        return links.values().stream()
                .filter(l -> l.involves(partnerAId) && l.involves(partnerBId))
                .findFirst();
    }

    /**
     * Сменить статус связки. Менять статус может только терапевт-владелец.
     */
    public CoupleLinkModels.CoupleLink updateStatus(String linkId, String therapistId, CoupleLinkModels.CoupleLinkStatus status) {
        synchronized (links) {
            CoupleLinkModels.CoupleLink link = getLink(linkId);
            if (!link.therapistId().equals(therapistId)) {
                throw new CoupleLinkException(CoupleLinkException.Reason.NOT_OWNED, "Not authorized to update this link");
            }
            CoupleLinkModels.CoupleLink updated = link.withStatus(status, Instant.now());
            links.put(linkId, updated);
            log.info("[MERGE] статус связки изменён linkId={} {} -> {}", linkId, link.status(), status);
            return updated;
        }
    }

    public CoupleLinkModels.CoupleLink pauseLink(String linkId, String therapistId) {
        return updateStatus(linkId, therapistId, CoupleLinkModels.CoupleLinkStatus.PAUSED);
    }

    public CoupleLinkModels.CoupleLink terminateLink(String linkId, String therapistId) {
        return updateStatus(linkId, therapistId, CoupleLinkModels.CoupleLinkStatus.TERMINATED);
    }

    public CoupleLinkModels.CoupleLink reactivateLink(String linkId, String therapistId) {
        return updateStatus(linkId, therapistId, CoupleLinkModels.CoupleLinkStatus.ACTIVE);
    }

    /**
     * @param status фильтр по статусу ({@code null}: все)
     */
    public List<CoupleLinkModels.CoupleLink> linksForTherapist(String therapistId, CoupleLinkModels.CoupleLinkStatus status) {
        return links.values().stream()
                .filter(l -> l.therapistId().equals(therapistId))
                .filter(l -> status == null || l.status() == status)
                .sorted(Comparator.comparing(CoupleLinkModels.CoupleLink::createdAt).thenComparing(CoupleLinkModels.CoupleLink::id))
                .collect(Collectors.toList());
    }

    /**
     * @param status фильтр по статусу ({@code null}: все)
     */
    public List<CoupleLinkModels.CoupleLink> linksForClient(String clientId, CoupleLinkModels.CoupleLinkStatus status) {
        return links.values().stream()
                .filter(l -> l.involves(clientId))
                .filter(l -> status == null || l.status() == status)
                .sorted(Comparator.comparing(CoupleLinkModels.CoupleLink::createdAt).thenComparing(CoupleLinkModels.CoupleLink::id))
                .collect(Collectors.toList());
    }

    @Override
    public boolean validateMergeAuthorization(String linkId, String therapistId) {
        CoupleLinkModels.CoupleLink link = getLink(linkId);
        if (therapistId == null || !link.therapistId().equals(therapistId)) {
            throw new CoupleLinkException(CoupleLinkException.Reason.NOT_OWNED, "Not authorized for this couple link");
        }
        if (!link.isActive()) {
            throw new CoupleLinkException(CoupleLinkException.Reason.NOT_ACTIVE,
                    "Link is not active: " + link.status().name().toLowerCase(Locale.ROOT));
        }
        return true;
    }

    private void requireClientOf(String clientId, String therapistId, String role) {
        String owner = clientTherapists.get(clientId);
        if (owner != null && !owner.equals(therapistId)) {
            throw new CoupleLinkException(CoupleLinkException.Reason.INVALID, role + " is not a client of this therapist");
        }
    }

    private static void requireUuid(String value, String field) {
        try {
            UUID.fromString(value == null ? "" : value);
        } catch (IllegalArgumentException e) {
            throw new CoupleLinkException(CoupleLinkException.Reason.INVALID, "Invalid UUID in " + field);
        }
    }
}
