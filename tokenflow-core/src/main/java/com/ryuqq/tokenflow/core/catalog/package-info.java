/**
 * Status catalog package.
 *
 * <p>Table-driven display metadata for every token status. Presentation layers
 * look up {@link com.ryuqq.tokenflow.core.catalog.StatusDescriptor} entries
 * instead of branching on status values.</p>
 *
 * <ul>
 *   <li>{@link com.ryuqq.tokenflow.core.catalog.StatusCatalog} - Exhaustive status → descriptor table with an UNKNOWN fallback</li>
 *   <li>{@link com.ryuqq.tokenflow.core.catalog.StatusTone} - Visual tone mapped to icon and colour by callers</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.tokenflow.core.catalog;
