/**
 * The source adapter contract, its failure boundary and the registry that builds adapters
 * by name. Concrete adapters live in one sub-package per protocol family.
 */
package fr.lapetina.domainreview.source;
