package com.example.resourceapi.security.annotation;

import java.lang.annotation.*;

// Inject the authenticated Token into controller method parameter
@Target(ElementType.PARAMETER)
@Retention(RetentionPolicy.RUNTIME)
@Documented
public @interface ResolvedToken {
}
