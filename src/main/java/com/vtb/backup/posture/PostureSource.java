package com.vtb.backup.posture;

import com.vtb.backup.models.VaultReference;

import java.util.Optional;

/**
 * Один источник сведений о состоянии хранилища
 */
public interface PostureSource {

    String name();

    /**
     * @return частичное состояние или пусто, если источник неприменим или недоступен
     */
    Optional<PartialPosture> attempt(VaultReference vault);
}
