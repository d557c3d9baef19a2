package com.ledgerimport.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Linked account-aggregator connection. Created by the account-linking flow; read-only here.
 */
@Document(collection = "aggregator_connections")
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class AggregatorConnection {

    @Id
    @EqualsAndHashCode.Include
    private String id;
    @Indexed
    private String ownerId;
    private String institutionName;
    private String accessToken;
    private List<String> accountIds = new ArrayList<>();
    private ConnectionStatus status;
    private Instant lastSyncedAt;

    public enum ConnectionStatus {
        ACTIVE,
        REQUIRES_REAUTH,
        DISCONNECTED,
        ERROR
    }
}
