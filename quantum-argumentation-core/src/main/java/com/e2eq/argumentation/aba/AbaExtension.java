package com.e2eq.argumentation.aba;

import com.e2eq.argumentation.dung.Extension;

import java.util.SortedSet;

/**
 * One extension of the translated framework, with the claims and assumptions it accepts.
 *
 * @param arguments   accepted argument ids
 * @param claims      claims of the accepted arguments
 * @param assumptions assumptions whose own argument {@code a:{a}} is accepted
 */
public record AbaExtension(Extension arguments, SortedSet<String> claims, SortedSet<String> assumptions) {
}
