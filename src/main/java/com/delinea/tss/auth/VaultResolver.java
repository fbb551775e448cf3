package com.delinea.tss.auth;

import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Finds the vault that Platform-authenticated requests must be sent to.
 *
 * <p>Lists vaults from the vault broker and takes the first one that is both default and
 * active. Nothing else is considered: if no vault matches, resolution fails rather than
 * falling back to another vault.
 */
public class VaultResolver {

    private static final Logger logger = LoggerFactory.getLogger(VaultResolver.class);

    static final String VAULTS_PATH = "vaultbroker/api/vaults";

    private final TssHttpClient client;

    public VaultResolver(TssHttpClient client) {
        this.client = client;
    }

    /**
     * Resolves the URL of the default active vault.
     *
     * @param platformToken bearer token issued by the Platform
     * @param baseUrl       the Platform base URL
     * @return the vault URL
     * @throws NoVaultFoundException if no vault is both default and active
     * @throws TssException          if the vault listing fails
     */
    public String resolveVault(String platformToken, String baseUrl) throws TssException {
        TssResponse response = client.get(TssHttpClient.join(baseUrl, VAULTS_PATH),
                platformToken, AuthStage.VAULT_DISCOVERY);

        if (response.getJson() == null) {
            throw new TssException("Vault broker response is not a JSON object",
                    response.getStatus(), AuthStage.VAULT_DISCOVERY);
        }

        List<Vault> vaults = Vault.listFromJson(response.getJson());
        Vault vault = selectDefault(vaults).orElseThrow(() -> new NoVaultFoundException(
                "No configured vault found: none of the " + vaults.size()
                        + " vaults at " + baseUrl + " is both default and active"));

        logger.info("Using vault '{}' at {}", vault.getName(), vault.getUrl());
        return vault.getUrl();
    }

    /**
     * The first vault with {@code isDefault && isActive} and a connection URL.
     */
    public static Optional<Vault> selectDefault(List<Vault> vaults) {
        for (Vault vault : vaults) {
            if (vault.isDefault() && vault.isActive() && !Preconditions.isBlank(vault.getUrl())) {
                return Optional.of(vault);
            }
        }
        return Optional.empty();
    }
}
