package com.feetrail.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

/**
 * Launched project from the registry. Read-only here; ownerWallet is set once the developer is verified.
 */
@Document(collection = "projects")
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class Project {

    @Id
    @EqualsAndHashCode.Include
    private String id;
    private String name;
    @Indexed(sparse = true)
    private String poolId;
    private String poolTokenAddress;
    private String ownerWallet;
}
