package com.reasons.spring;

import com.reasons.adapter.spring.ReasonsAutoConfiguration;
import org.springframework.context.annotation.Import;

import java.lang.annotation.*;

/**
 * Enable the Reasons rule engine in a Spring application.
 *
 * Usage:
 * <pre>
 * &#64;SpringBootApplication
 * &#64;EnableReasons
 * public class MyApplication {
 *     public static void main(String[] args) {
 *         SpringApplication.run(MyApplication.class, args);
 *     }
 * }
 * </pre>
 */
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
@Documented
@Import(ReasonsAutoConfiguration.class)
public @interface EnableReasons {
}
