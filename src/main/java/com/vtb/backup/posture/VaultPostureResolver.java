package com.vtb.backup.posture;

import com.vtb.backup.config.AuditConfig;
import com.vtb.backup.http.AuthenticationException;
import com.vtb.backup.http.ResilientGetClient;
import com.vtb.backup.models.SoftDeleteState;
import com.vtb.backup.models.VaultPosture;
import com.vtb.backup.models.VaultReference;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Сведение нескольких источников в одно состояние хранилища.
 *
 * Источники опрашиваются по убыванию авторитетности: первое непустое значение
 * выигрывает, последующие только заполняют пробелы. Опрос прекращается, как только
 * известны soft delete, срок хранения, избыточность и межподписочное восстановление.
 * Уровень безопасности не сливается, а вычисляется заново из итоговых полей.
 */
@Slf4j
public class VaultPostureResolver {

    private final List<PostureSource> sources;

    public VaultPostureResolver(List<PostureSource> sources) {
        this.sources = new ArrayList<>(sources);
    }

    /**
     * Стандартная цепочка: vault, backupstorageconfig, backupconfig (текущий, затем устаревший API)
     */
    public static VaultPostureResolver standard(ResilientGetClient client, AuditConfig.ApiVersions apiVersions) {
        return new VaultPostureResolver(List.of(
            new VaultRootPostureSource(client, apiVersions),
            new BackupStorageConfigSource(client, apiVersions),
            new BackupConfigSource(client, apiVersions.getVaultConfigCurrent(), "current"),
            new BackupConfigSource(client, apiVersions.getVaultConfigLegacy(), "legacy")
        ));
    }

    public VaultPosture resolve(VaultReference vault) {
        PartialPosture merged = new PartialPosture();
        List<String> contributors = new ArrayList<>();

        for (PostureSource source : sources) {
            if (merged.isComplete()) {
                log.debug("Состояние {} определено полностью, источник {} не нужен", vault.getName(), source.name());
                break;
            }
            Optional<PartialPosture> partial = attempt(source, vault);
            if (partial.isPresent() && !partial.get().isEmpty()) {
                merged.fillFrom(partial.get());
                contributors.add(source.name());
            }
        }

        if (!merged.isComplete()) {
            log.info("Состояние хранилища {} определено не полностью (источники: {})", vault.getName(), contributors);
        }

        SoftDeleteState softDelete = merged.getSoftDeleteState() != null
            ? merged.getSoftDeleteState()
            : SoftDeleteState.UNKNOWN;

        return VaultPosture.builder()
            .vaultId(vault.getId())
            .vaultName(vault.getName())
            .subscriptionId(vault.getSubscriptionId())
            .resourceGroup(vault.getResourceGroup())
            .location(vault.getLocation())
            .family(vault.getFamily())
            .storageRedundancy(merged.getStorageRedundancy())
            .crossRegionRestore(merged.getCrossRegionRestore())
            .crossSubscriptionRestore(merged.getCrossSubscriptionRestore())
            .softDeleteState(softDelete)
            .softDeleteRetentionDays(merged.getSoftDeleteRetentionDays())
            .hybridSecurityEnabled(merged.getHybridSecurityEnabled())
            .multiUserAuthorization(merged.getMultiUserAuthorization())
            .immutability(merged.getImmutability())
            .securityLevel(VaultPosture.deriveSecurityLevel(
                merged.getHybridSecurityEnabled(), merged.getMultiUserAuthorization(), softDelete))
            .resolvedFrom(List.copyOf(contributors))
            .build();
    }

    private Optional<PartialPosture> attempt(PostureSource source, VaultReference vault) {
        try {
            return source.attempt(vault);
        } catch (AuthenticationException e) {
            throw e;
        } catch (RuntimeException e) {
            log.warn("Источник {} для хранилища {} завершился ошибкой: {}", source.name(), vault.getName(), e.getMessage());
            return Optional.empty();
        }
    }
}
