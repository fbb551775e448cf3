package com.delinea.tss.auth.ntlm;

import com.delinea.tss.auth.UnsupportedCapabilityException;
import java.util.Locale;

/**
 * Access to the operating system service that computes NTLM messages for the current user.
 *
 * <p>Only Windows offers such a service. Elsewhere {@link #forCurrentPlatform()} returns an
 * implementation whose {@link #isSupported()} is false and whose {@link #newContext()}
 * throws {@link UnsupportedCapabilityException}.
 */
public interface ChallengeResponseProvider {

    /**
     * Whether contexts can be created on this platform.
     */
    boolean isSupported();

    /**
     * Acquires the current user's credentials handle and opens a context for one exchange.
     *
     * @return a new context
     * @throws UnsupportedCapabilityException if the platform has no NTLM security service
     */
    NtlmContext newContext() throws UnsupportedCapabilityException;

    /**
     * Selects the provider for the running operating system.
     */
    static ChallengeResponseProvider forCurrentPlatform() {
        String osName = System.getProperty("os.name", "");
        if (osName.toLowerCase(Locale.ROOT).startsWith("windows")) {
            return new WindowsSspiProvider();
        }
        return new UnsupportedChallengeResponseProvider(osName);
    }
}
