package com.storefront.authservice.utils;

import java.lang.annotation.*;

/** Message placed in the success envelope for a handler (or every handler of a controller). */
@Target({ElementType.METHOD, ElementType.TYPE})
@Retention(RetentionPolicy.RUNTIME)
@Documented
public @interface ResponseMessage {
    String value() default "OK";
}
