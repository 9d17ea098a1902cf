package com.ttennebkram.radiograph.processing;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Metadata for {@link StageBase} subclasses.
 *
 * Example usage:
 * <pre>
 * {@literal @}StageInfo(
 *     name = "Sharpen",
 *     description = "Unsharp mask\nCore.addWeighted(src, s, blur, 1 - s, 0, dst)"
 * )
 * public class SharpenStage extends StageBase { ... }
 * </pre>
 */
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.TYPE)
public @interface StageInfo {

    /**
     * Stage name reported in failures and logs.
     */
    String name();

    /**
     * Description including the OpenCV call.
     */
    String description() default "";
}
