/**
 * REST API layer.
 *
 * <ul>
 *   <li>{@code TaskListController} - list, search, read, write and delete task lists</li>
 *   <li>{@code DataSourceController} - health of the configured storage sources</li>
 * </ul>
 *
 * <p>Every response body is an {@link com.purchasingpower.taskhub.api.ApiResponse}.
 *
 * @since 1.0.0
 */
package com.purchasingpower.taskhub.api;
