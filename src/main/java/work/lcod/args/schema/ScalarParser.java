package work.lcod.args.schema;

import work.lcod.args.value.RawValue;

/**
 * Schema-author supplied conversion from a literal (or a structurally converted variable value) to a domain value.
 * Never receives {@link RawValue.Absent}, {@link RawValue.LiteralNull} or {@link RawValue.VariableRef}.
 */
@FunctionalInterface
public interface ScalarParser {
    ParseResult parse(RawValue raw);
}
