/**
 * Extension health aggregation.
 */
package habitkit.health;
