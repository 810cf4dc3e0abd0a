package me.x150.cctask.conf.descriptor;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.FIELD)
public @interface DescriptorValue {
	String value();

	String description() default "";

	boolean required() default false;

	/**
	 * Regex splitting the raw value of an array-typed field
	 */
	String separator() default ",";
}
