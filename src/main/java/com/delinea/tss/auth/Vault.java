package com.delinea.tss.auth;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * A vault registered with the Platform vault broker.
 *
 * <pre>{@code
 * {
 *   "vaultId": "...", "name": "...", "type": "...",
 *   "isDefault": true, "isGlobalDefault": false, "isActive": true,
 *   "connection": { "url": "https://vault.example.com/", "oAuthProfileId": "..." }
 * }
 * }</pre>
 */
public final class Vault {

    private final String vaultId;
    private final String name;
    private final String type;
    private final boolean isDefault;
    private final boolean isGlobalDefault;
    private final boolean isActive;
    private final String url;
    private final String oAuthProfileId;

    public Vault(String vaultId, String name, String type, boolean isDefault, boolean isGlobalDefault,
                 boolean isActive, String url, String oAuthProfileId) {
        this.vaultId = vaultId;
        this.name = name;
        this.type = type;
        this.isDefault = isDefault;
        this.isGlobalDefault = isGlobalDefault;
        this.isActive = isActive;
        this.url = url;
        this.oAuthProfileId = oAuthProfileId;
    }

    static Vault fromJson(Map<String, Object> json) {
        Map<String, Object> connection = JsonUtil.getObject(json, "connection");
        return new Vault(
                JsonUtil.getString(json, "vaultId"),
                JsonUtil.getString(json, "name"),
                JsonUtil.getString(json, "type"),
                JsonUtil.getBoolean(json, "isDefault"),
                JsonUtil.getBoolean(json, "isGlobalDefault"),
                JsonUtil.getBoolean(json, "isActive"),
                JsonUtil.getString(connection, "url"),
                JsonUtil.getString(connection, "oAuthProfileId"));
    }

    /**
     * Reads the {@code vaults} array of a vault broker response, in response order.
     */
    public static List<Vault> listFromJson(Map<String, Object> root) {
        List<Vault> vaults = new ArrayList<>();
        for (Map<String, Object> item : JsonUtil.getObjectList(root, "vaults")) {
            vaults.add(fromJson(item));
        }
        return vaults;
    }

    public String getVaultId() {
        return vaultId;
    }

    public String getName() {
        return name;
    }

    public String getType() {
        return type;
    }

    public boolean isDefault() {
        return isDefault;
    }

    public boolean isGlobalDefault() {
        return isGlobalDefault;
    }

    public boolean isActive() {
        return isActive;
    }

    public String getUrl() {
        return url;
    }

    public String getOAuthProfileId() {
        return oAuthProfileId;
    }

    @Override
    public String toString() {
        return "Vault{vaultId='" + vaultId + "', name='" + name + "', url='" + url
                + "', isDefault=" + isDefault + ", isActive=" + isActive + '}';
    }
}
