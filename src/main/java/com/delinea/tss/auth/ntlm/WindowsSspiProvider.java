package com.delinea.tss.auth.ntlm;

import com.delinea.tss.auth.UnsupportedCapabilityException;
import com.sun.jna.platform.win32.Sspi;
import com.sun.jna.platform.win32.SspiUtil.ManagedSecBufferDesc;
import com.sun.jna.platform.win32.Win32Exception;
import waffle.windows.auth.IWindowsCredentialsHandle;
import waffle.windows.auth.impl.WindowsAccountImpl;
import waffle.windows.auth.impl.WindowsCredentialsHandleImpl;
import waffle.windows.auth.impl.WindowsSecurityContextImpl;

/**
 * NTLM messages computed by the Windows SSPI for the logged-on user, through Waffle.
 *
 * <p>This class touches Windows-only native code; it is only instantiated by
 * {@link ChallengeResponseProvider#forCurrentPlatform()} on Windows.
 */
class WindowsSspiProvider implements ChallengeResponseProvider {

    static final String SECURITY_PACKAGE = "NTLM";

    @Override
    public boolean isSupported() {
        return true;
    }

    @Override
    public NtlmContext newContext() throws UnsupportedCapabilityException {
        try {
            IWindowsCredentialsHandle credentials = WindowsCredentialsHandleImpl.getCurrent(SECURITY_PACKAGE);
            credentials.initialize();
            return new SspiContext(credentials, WindowsAccountImpl.getCurrentUsername());
        } catch (Win32Exception | LinkageError e) {
            throw new UnsupportedCapabilityException(
                    "Cannot acquire NTLM credentials for the current user: " + e.getMessage(), e);
        }
    }

    private static final class SspiContext implements NtlmContext {
        private final IWindowsCredentialsHandle credentials;
        private final WindowsSecurityContextImpl context = new WindowsSecurityContextImpl();
        private final String principal;

        SspiContext(IWindowsCredentialsHandle credentials, String principal) {
            this.credentials = credentials;
            this.principal = principal;
            context.setPrincipalName(principal);
            context.setCredentialsHandle(credentials);
            context.setSecurityPackage(SECURITY_PACKAGE);
        }

        @Override
        public byte[] negotiateMessage() throws NtlmProtocolException {
            try {
                context.initialize(null, null, principal);
                return context.getToken();
            } catch (Win32Exception e) {
                throw new NtlmProtocolException("SSPI could not create the negotiate message: "
                        + e.getMessage(), 0, e);
            }
        }

        @Override
        public byte[] authenticateMessage(byte[] challenge) throws NtlmProtocolException {
            try {
                ManagedSecBufferDesc token = new ManagedSecBufferDesc(Sspi.SECBUFFER_TOKEN, challenge);
                context.initialize(context.getHandle(), token, principal);
                return context.getToken();
            } catch (Win32Exception e) {
                throw new NtlmProtocolException("SSPI rejected the NTLM challenge: " + e.getMessage(), 0, e);
            }
        }

        @Override
        public void close() {
            context.dispose();
            credentials.dispose();
        }
    }
}
