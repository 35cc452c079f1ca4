/**
 * Sources that need a multi-step exchange: fetch a form, echo its cookies and hidden
 * tokens back in a POST, then scrape the result page. Each lookup uses its own
 * {@link fr.lapetina.domainreview.infrastructure.http.SessionContext}.
 */
package fr.lapetina.domainreview.source.form;
