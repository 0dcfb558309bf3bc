package com.sibol.contract_ledger.persistence;

import com.sibol.contract_ledger.contract.SignatoryRole;
import com.sibol.contract_ledger.contract.Signature;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.IdClass;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.io.Serializable;
import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "contract_signatures")
@IdClass(SignatureEntity.Key.class)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class SignatureEntity {

    @Id
    @Column(name = "contract_id", nullable = false, updatable = false)
    private UUID contractId;

    @Id
    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false, length = 16)
    private SignatoryRole role;

    @Column(nullable = false)
    private boolean signed;

    @Column(name = "signed_at")
    private Instant signedAt;

    @Column(columnDefinition = "TEXT")
    private String payload;

    static SignatureEntity fromDomain(UUID contractId, Signature signature) {
        SignatureEntity entity = new SignatureEntity();
        entity.contractId = contractId;
        entity.role = signature.getRole();
        entity.signed = signature.isSigned();
        entity.signedAt = signature.getSignedAt();
        entity.payload = signature.getPayload();
        return entity;
    }

    Signature toDomain() {
        return signed ? Signature.signed(role, signedAt, payload) : Signature.unsigned(role);
    }

    @EqualsAndHashCode
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Key implements Serializable {
        private UUID contractId;
        private SignatoryRole role;
    }
}
