/**
 * Public API for the Field Log SDK.
 *
 * <p>This package contains all public interfaces and classes that users
 * should interact with directly.</p>
 *
 * <h2>Main Entry Points:</h2>
 * <ul>
 *   <li>{@link io.github.hongjungwan.fieldlog.api.Log} - Process-wide static facade</li>
 *   <li>{@link io.github.hongjungwan.fieldlog.api.LogFacade} - Injectable facade owning one engine</li>
 *   <li>{@link io.github.hongjungwan.fieldlog.api.StructuredLogger} - Leveled, field-based logger</li>
 *   <li>{@link io.github.hongjungwan.fieldlog.api.field.Fields} - Typed field constructors</li>
 *   <li>{@link io.github.hongjungwan.fieldlog.api.context.RequestContext} - Trace-correlation source</li>
 * </ul>
 *
 * <h2>Usage Example:</h2>
 * <pre>{@code
 * import io.github.hongjungwan.fieldlog.api.Log;
 * import static io.github.hongjungwan.fieldlog.api.field.Fields.*;
 *
 * public class PayrollService {
 *
 *     public void process(RequestContext ctx, String employeeId) {
 *         Log.withContext(ctx).info("processing payroll",
 *                 string("employee_id", employeeId),
 *                 duration("elapsed", Duration.ofMillis(42)));
 *     }
 * }
 * }</pre>
 *
 * @since 1.0.0
 */
package io.github.hongjungwan.fieldlog.api;
