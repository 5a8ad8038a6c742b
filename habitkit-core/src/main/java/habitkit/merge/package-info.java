/**
 * Merging hook results into per-habit write sets.
 *
 * @see habitkit.merge.IntegrationMerger
 * @see habitkit.merge.IntegrationDocuments
 */
package habitkit.merge;
