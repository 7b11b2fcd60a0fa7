package tech.yump.rotation.config.validation;

import jakarta.validation.Constraint;
import jakarta.validation.Payload;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Cross-field rules of a secret class policy: positive durations and a satisfiable approval quorum.
 */
@Documented
@Constraint(validatedBy = RotationPolicyValidator.class)
@Target({ElementType.TYPE})
@Retention(RetentionPolicy.RUNTIME)
public @interface ValidRotationPolicy {
    String message() default "Invalid rotation policy.";
    Class<?>[] groups() default {};
    Class<? extends Payload>[] payload() default {};
}
