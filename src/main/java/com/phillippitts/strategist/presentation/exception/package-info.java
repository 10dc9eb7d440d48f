/**
 * Translation of domain exceptions into HTTP responses with a uniform error body.
 */
package com.phillippitts.strategist.presentation.exception;
