/**
 * JSON API sources, including the primary VirusTotal report and the Cymon IP check.
 */
package fr.lapetina.domainreview.source.rest;
