package mediaflow.error;

import mediaflow.MediaKind;

/**
 * English messages with a friendly tone.
 */
public final class DefaultUserMessages implements UserMessages {

    @Override
    public String failure(FailureKind kind, MediaKind media) {
        String noun = noun(media);
        return switch (kind) {
            case SAFETY_BLOCKED -> "This " + noun + " was blocked by the content safety filter, "
                    + "so I can't describe it.";
            case FILE_EXPIRED -> "Processing this " + noun + " took too long and the upload expired. "
                    + "Please send it again.";
            case FILE_FORBIDDEN -> "I lost access to this " + noun + " while processing it. "
                    + "Please send it again.";
            case FILE_TOO_LARGE -> "This " + noun + " is too large for me to process. "
                    + "Try a smaller file.";
            case UNSUPPORTED_FORMAT -> "This " + noun + " format is not supported. "
                    + "Try a common format such as JPEG, PNG or MP4.";
            case PROCESSING_FAILED -> "The " + noun + " could not be processed. "
                    + "It may be corrupted, please try another file.";
            case TIMEOUT -> "Analyzing this " + noun + " took too long. "
                    + (media == MediaKind.VIDEO
                    ? "Try a shorter clip."
                    : "Try a simpler or smaller image.");
            case QUOTA_EXCEEDED, SERVICE_UNAVAILABLE -> "The service is temporarily overloaded. "
                    + "Please try again shortly.";
            case GENERAL -> "Something went wrong while processing your " + noun + ". "
                    + "Please try again later.";
        };
    }

    @Override
    public String stillProcessing(MediaKind media) {
        return "Still processing your " + noun(media) + ", hang on...";
    }

    @Override
    public String takingLonger(MediaKind media) {
        return "This " + noun(media) + " is taking longer than usual to process. "
                + "I'll reply as soon as it's ready.";
    }

    @Override
    public String emptyResponse(MediaKind media) {
        return "I couldn't produce a clear description of this " + noun(media) + ".";
    }

    private static String noun(MediaKind media) {
        return switch (media) {
            case VIDEO -> "video";
            case IMAGE -> "image";
            case AUDIO -> "audio";
            case TEXT -> "message";
        };
    }
}
