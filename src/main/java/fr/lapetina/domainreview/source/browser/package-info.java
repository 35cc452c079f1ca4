/**
 * Sources that only answer to a rendering browser. The engine itself is behind
 * {@link fr.lapetina.domainreview.source.browser.BrowserSessionFactory}.
 */
package fr.lapetina.domainreview.source.browser;
