/**
 * Endpoint collaborator contract and lifecycle event plumbing.
 *
 * <p>An {@link express.mvp.myra.objects.endpoint.Endpoint} reports two events about its backing
 * process: destruction and transparent swap. Listeners are registered per event and return a
 * {@link express.mvp.myra.objects.endpoint.Subscription} token.
 *
 * <h2>Key Components</h2>
 *
 * <ul>
 *   <li>{@link express.mvp.myra.objects.endpoint.Endpoint} - Collaborator contract
 *   <li>{@link express.mvp.myra.objects.endpoint.EndpointEvents} - Reusable listener dispatcher
 *   <li>{@link express.mvp.myra.objects.endpoint.HostedEndpoint} - Ready-made host-side endpoint
 * </ul>
 */
package express.mvp.myra.objects.endpoint;
