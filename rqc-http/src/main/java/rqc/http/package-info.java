/**
 * HTTP transport for the RQC service built on {@link java.net.http.HttpClient} and Jackson.
 */
package rqc.http;
