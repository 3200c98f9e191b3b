package io.pipewright.core.stage;

import java.util.Objects;

/// Base class for single-input stages with statically typed input and output.
///
/// Derives the {@link StageSignature} from the constructor arguments and casts
/// the incoming port value before delegating to {@link #process}.
///
/// ### Usage
/// {@snippet :
/// class ThingGrouper extends TypedStage<ThingList, GroupedThings> {
///     ThingGrouper() {
///         super(ThingList.class, GroupedThings.class);
///     }
///
///     @Override
///     protected GroupedThings process(ThingList things, StageContext context) {
///         return GroupedThings.byKeyword(things);
///     }
/// }
/// }
///
/// @param <I> input type
/// @param <O> output type
public abstract class TypedStage<I, O> implements Stage {

    private final Class<I> inputType;
    private final StageSignature signature;

    /// Creates a typed stage.
    ///
    /// @param inputType accepted input type, not null
    /// @param outputType produced output type, not null
    protected TypedStage(Class<I> inputType, Class<O> outputType) {
        this.inputType = Objects.requireNonNull(inputType, "inputType");
        this.signature = StageSignature.of(inputType, Objects.requireNonNull(outputType));
    }

    @Override
    public final Object run(StageInput input, StageContext context) throws StageFailure {
        I value;
        try {
            value = input.single(inputType);
        } catch (ClassCastException | IllegalStateException e) {
            throw StageFailure.permanentFailure(
                    "Input of stage '" + context.getStageId() + "' is not a "
                            + inputType.getSimpleName(),
                    e);
        }
        return process(value, context);
    }

    /// Processes one input value.
    ///
    /// @param input the input value, may be null
    /// @param context invocation context, not null
    /// @return output value, may be null
    /// @throws StageFailure on a declared failure
    protected abstract O process(I input, StageContext context) throws StageFailure;

    @Override
    public final StageSignature signature() {
        return signature;
    }
}
