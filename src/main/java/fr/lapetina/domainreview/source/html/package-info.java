/**
 * Sources answered by a single stateless GET whose HTML page is scraped.
 */
package fr.lapetina.domainreview.source.html;
