// SPDX-License-Identifier: MIT OR Apache-2.0
package io.factom.core;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a type or member that is public only so that other Factom client
 * modules can reach it.
 *
 * <p>Annotated elements, typically the helpers in {@code io.factom.rpc.internal},
 * may change or disappear between releases without notice.
 */
@Documented
@Retention(RetentionPolicy.CLASS)
@Target({ElementType.TYPE, ElementType.METHOD, ElementType.CONSTRUCTOR, ElementType.FIELD})
public @interface InternalApi {
}
