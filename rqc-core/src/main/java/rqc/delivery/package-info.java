/**
 * Contract of the RQC transport and the classification of its results.
 *
 * <p>The {@code rqc-http} module implements {@link rqc.delivery.DeliveryClient} over HTTP.
 */
package rqc.delivery;
