package com.vtb.backup.models;

import lombok.Builder;
import lombok.Value;

/**
 * Хранилище, найденное при перечислении подписки
 */
@Value
@Builder
public class VaultReference {
    String id;
    String name;
    String subscriptionId;
    String resourceGroup;
    String location;
    VaultFamily family;
}
