package io.github.cyfko.approvalql.core.parsing;

/**
 * States of the attribute block reader, named after the last thing read.
 * <pre>
 * IN_ATTRIB --name--&gt; IN_NAME --'='--&gt; IN_EQ --name--&gt; IN_VAL --']'--&gt; done
 *                        ^                               |
 *                        +--name-- IN_COMMA &lt;---','------+
 * </pre>
 */
enum AttributeState {
    /** Just after {@code [}. */
    IN_ATTRIB,
    /** After a key. */
    IN_NAME,
    /** After {@code =}. */
    IN_EQ,
    /** After a value; the only state a {@code ]} may close. */
    IN_VAL,
    /** After a {@code ,} separating pairs. */
    IN_COMMA
}
