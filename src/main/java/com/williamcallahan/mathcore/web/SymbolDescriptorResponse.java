package com.williamcallahan.mathcore.web;

import com.williamcallahan.mathcore.service.mathml.symbol.SymbolDescriptor;
import java.util.Locale;

/**
 * Published operator metadata for one codepoint.
 *
 * @param status fixed "success"
 * @param codepoint codepoint in {@code U+XXXX} form
 * @param text the character
 * @param symbolClass relation, binary operator, operator or ordinary-like
 * @param category fine-grained subcategory
 * @param stretchy stretch behavior
 * @param largeOperator whether the symbol is a large operator
 * @param movableLimits whether limits move to scripts in inline display
 * @param prefixForm whether the symbol has a prefix form
 * @param lineBreakable whether a line may break at the symbol
 */
public record SymbolDescriptorResponse(
    String status,
    String codepoint,
    String text,
    String symbolClass,
    String category,
    String stretchy,
    boolean largeOperator,
    boolean movableLimits,
    boolean prefixForm,
    boolean lineBreakable
) implements ApiResponse {

    public static SymbolDescriptorResponse from(SymbolDescriptor descriptor) {
        return new SymbolDescriptorResponse(
            "success",
            String.format(Locale.ROOT, "U+%04X", descriptor.codepoint()),
            descriptor.text(),
            descriptor.symbolClass().name(),
            descriptor.category().name(),
            descriptor.stretchy().name(),
            descriptor.category().largeOperator(),
            descriptor.category().movableLimits(),
            descriptor.category().prefixForm(),
            descriptor.isLineBreakable());
    }
}
