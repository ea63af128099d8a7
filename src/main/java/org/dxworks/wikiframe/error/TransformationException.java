package org.dxworks.wikiframe.error;

public class TransformationException extends WikiframeException {

    public TransformationException(TransformationError error) {
        super(error);
    }

    @Override
    public TransformationError getError() {
        return (TransformationError) super.getError();
    }

    public String getTransformationName() {
        return getError().transformationName;
    }
}
