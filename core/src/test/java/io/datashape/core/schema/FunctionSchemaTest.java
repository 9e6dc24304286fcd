package io.datashape.core.schema;

import static io.datashape.core.schema.Schemas.function;
import static io.datashape.core.schema.Schemas.number;
import static io.datashape.core.schema.Schemas.string;
import static io.datashape.core.schema.Schemas.tuple;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowable;

import io.datashape.core.error.ValidationException;
import io.datashape.core.model.Issue;
import io.datashape.core.model.IssueKind;
import io.datashape.core.model.IssuePayload;
import io.datashape.core.spi.SchemaFunction;
import java.util.function.Function;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("FunctionSchema")
class FunctionSchemaTest {

    private final FunctionSchema greeter = function().args(string()).returns(string());

    @Test
    void validCall_returnsResult() {
        SchemaFunction greet = greeter.implement(args -> "Hello " + args.get(0));

        assertThat(greet.invoke("Ada")).isEqualTo("Hello Ada");
    }

    @Test
    void invalidArguments_throwWithNestedError() {
        SchemaFunction greet = greeter.implement(args -> "Hello " + args.get(0));

        ValidationException error = (ValidationException) catchThrowable(() -> greet.invoke(42));

        Issue issue = error.issues().get(0);
        assertThat(issue.kind()).isEqualTo(IssueKind.INVALID_ARGUMENTS);
        assertThat(issue.message()).isEqualTo("Invalid function arguments");
        ValidationException nested = ((IssuePayload.NestedError) issue.payload()).error();
        assertThat(nested.issues().get(0).path()).containsExactly(0);
    }

    @Test
    void invalidReturn_throwsInvalidReturnType() {
        SchemaFunction broken = greeter.implement(args -> 7);

        ValidationException error = (ValidationException) catchThrowable(() -> broken.invoke("Ada"));

        assertThat(error.issues().get(0).kind()).isEqualTo(IssueKind.INVALID_RETURN_TYPE);
        assertThat(error.issues().get(0).message()).isEqualTo("Invalid function return type");
    }

    @Test
    void implementationNotCalledOnBadArguments() {
        int[] calls = {0};
        SchemaFunction counted = greeter.implement(args -> {
            calls[0]++;
            return "x";
        });

        assertThatThrownBy(() -> counted.invoke()).isInstanceOf(ValidationException.class);
        assertThat(calls[0]).isZero();
    }

    @Test
    void parsedArgumentsAndReturnArePassedOn() {
        FunctionSchema doubler = function(tuple(string().transform(s -> Integer.parseInt(s))), number());
        SchemaFunction fn = doubler.implement(args -> ((Integer) args.get(0)) * 2);

        assertThat(fn.invoke("21")).isEqualTo(42);
    }

    @Test
    void plainJavaFunctionIsAccepted() {
        Function<Object, Object> shout = value -> String.valueOf(value).toUpperCase();

        SchemaFunction wrapped = greeter.parse(shout);

        assertThat(wrapped.invoke("hi")).isEqualTo("HI");
    }

    @Test
    void nonFunction_isInvalidType() {
        Issue issue = greeter.safeParse("not callable").error().issues().get(0);

        assertThat(issue.message()).isEqualTo("Expected function, received string");
    }

    @Test
    void hintRendersSignature() {
        assertThat(greeter.hint()).isEqualTo("(string) => string");
        assertThat(function().hint()).isEqualTo("(...unknown[]) => unknown");
    }
}
