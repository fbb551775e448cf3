package com.delinea.tss.auth;

/**
 * Platform vault discovery returned no vault that is both default and active.
 */
public class NoVaultFoundException extends TssException {

    public NoVaultFoundException(String message) {
        super(message, 0, AuthStage.VAULT_DISCOVERY);
    }
}
