package com.delinea.tss.auth.ntlm;

import com.delinea.tss.auth.UnsupportedCapabilityException;

/**
 * Provider for platforms without an NTLM security service.
 */
public class UnsupportedChallengeResponseProvider implements ChallengeResponseProvider {

    private final String platform;

    public UnsupportedChallengeResponseProvider(String platform) {
        this.platform = platform;
    }

    @Override
    public boolean isSupported() {
        return false;
    }

    @Override
    public NtlmContext newContext() throws UnsupportedCapabilityException {
        throw new UnsupportedCapabilityException(
                "NTLM authentication is only available on Windows (running on " + platform + ")");
    }
}
