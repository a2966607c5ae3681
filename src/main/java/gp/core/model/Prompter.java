package gp.core.model;

/**
 * Host UI that asks the user about an origin.
 * Both calls are fire-and-forget: the answer comes back through
 * {@code PermissionNegotiator.provideDecision}.
 * Called with the negotiator's lock held; don't call into another tab synchronously.
 */
public interface Prompter {
    void showPrompt(String origin);

    void hidePrompt();
}
