package energy.p2p.market.exception;

/**
 * No installed record exists for the requested installation id
 */
public class InstallationNotInstalledException extends ValidationException {

    public InstallationNotInstalledException(long installationId) {
        super("Installation not installed: " + installationId);
    }
}
