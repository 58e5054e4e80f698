package com.my.seatbot.adapter.out.persistence;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.my.seatbot.domain.exception.StorageException;
import com.my.seatbot.domain.model.DonationClaim;
import com.my.seatbot.domain.model.Subscriber;
import com.my.seatbot.domain.port.out.RecordStore;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;

/**
 * Keeps a whole registry as one JSON array on disk. Saves go to a sibling temp file first and are
 * then moved over the target, so a crash mid-write leaves the previous document intact.
 *
 * @param <T> domain record
 * @param <D> document shape written to disk
 */
public class JsonFileRecordStore<T, D extends KeyedDocument> implements RecordStore<T> {

    private static final Logger log = Logger.getLogger(JsonFileRecordStore.class);

    private final Path path;
    private final ObjectMapper objectMapper;
    private final JavaType documentListType;
    private final Function<T, D> toDocument;
    private final Function<D, T> toDomain;

    JsonFileRecordStore(Path path,
                        ObjectMapper objectMapper,
                        Class<D> documentType,
                        Function<T, D> toDocument,
                        Function<D, T> toDomain) {
        this.path = path;
        this.objectMapper = objectMapper.copy()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.ADJUST_DATES_TO_CONTEXT_TIME_ZONE)
                .enable(SerializationFeature.INDENT_OUTPUT);
        this.documentListType = this.objectMapper.getTypeFactory().constructCollectionType(List.class, documentType);
        this.toDocument = toDocument;
        this.toDomain = toDomain;
    }

    public static RecordStore<Subscriber> subscribers(Path path, ObjectMapper objectMapper) {
        return new JsonFileRecordStore<>(path, objectMapper, SubscriberDocument.class,
                SubscriberDocument::from, SubscriberDocument::toDomain);
    }

    public static RecordStore<DonationClaim> donations(Path path, ObjectMapper objectMapper) {
        return new JsonFileRecordStore<>(path, objectMapper, DonationClaimDocument.class,
                DonationClaimDocument::from, DonationClaimDocument::toDomain);
    }

    /**
     * A missing file is an empty registry. An unreadable one is logged and also treated as empty.
     * Entries without a chat id cannot be addressed and are dropped.
     */
    @Override
    public List<T> load() {
        if (!Files.exists(path)) {
            return List.of();
        }
        try {
            List<D> documents = objectMapper.readValue(path.toFile(), documentListType);
            if (documents == null) {
                return List.of();
            }
            List<D> keyed = documents.stream()
                    .filter(Objects::nonNull)
                    .filter(document -> document.chatId() != null && !document.chatId().isBlank())
                    .toList();
            if (keyed.size() < documents.size()) {
                log.warnf("Skipped %d entries without chat_id in %s", documents.size() - keyed.size(), path);
            }
            return keyed.stream().map(toDomain).toList();
        } catch (IOException e) {
            log.warnf("Could not read %s, starting empty: %s", path, e.getMessage());
            return List.of();
        }
    }

    @Override
    public void saveAll(List<T> records) {
        List<D> documents = records.stream().map(toDocument).toList();
        Path temp = path.resolveSibling(path.getFileName() + ".tmp");
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            objectMapper.writeValue(temp.toFile(), documents);
            moveIntoPlace(temp);
        } catch (IOException e) {
            throw new StorageException("Could not write " + path, e);
        }
    }

    private void moveIntoPlace(Path temp) throws IOException {
        try {
            Files.move(temp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            log.debugf("Atomic move unsupported for %s, falling back to plain replace", path);
            Files.move(temp, path, StandardCopyOption.REPLACE_EXISTING);
        }
    }
}
