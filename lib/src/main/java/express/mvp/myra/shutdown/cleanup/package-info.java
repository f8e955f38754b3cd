/**
 * Safety net for shutdown tokens that are dropped without being closed.
 *
 * <p>{@link express.mvp.myra.shutdown.cleanup.TokenCleaner} ties the release of a token to the
 * token's reachability, so abandoning a token has the same effect as closing it.
 */
package express.mvp.myra.shutdown.cleanup;
