/**
 * Journal credentials and their validation against RQC.
 */
package rqc.credential;
