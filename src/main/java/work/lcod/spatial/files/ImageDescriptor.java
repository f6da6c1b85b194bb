package work.lcod.spatial.files;

import java.util.Arrays;
import java.util.Objects;
import work.lcod.spatial.resource.Resource;
import work.lcod.spatial.runtime.TypeKey;
import work.lcod.spatial.validation.Checks;

/**
 * Image file used by textures; the bytes are present only once fetched.
 */
public final class ImageDescriptor extends Resource {
    public static final TypeKey TYPE = new TypeKey("files", "image");

    private String contentType;
    private Long contentLength;
    private byte[] content;

    @Override
    public TypeKey typeKey() {
        return TYPE;
    }

    public String contentType() {
        return contentType;
    }

    public void setContentType(String contentType) {
        this.contentType = contentType;
    }

    public Long contentLength() {
        return contentLength;
    }

    public void setContentLength(Long contentLength) {
        if (contentLength != null) {
            Checks.atLeast("content_length", contentLength, 0, this);
        }
        this.contentLength = contentLength;
    }

    public boolean isMaterialized() {
        return content != null;
    }

    public byte[] content() {
        return content == null ? null : content.clone();
    }

    public void setContent(byte[] content) {
        this.content = content == null ? null : content.clone();
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof ImageDescriptor that)) {
            return false;
        }
        return sameIdentity(that)
            && Objects.equals(contentType, that.contentType)
            && Objects.equals(contentLength, that.contentLength)
            && Arrays.equals(content, that.content);
    }

    @Override
    public int hashCode() {
        return Objects.hash(identityHash(), contentType, contentLength, Arrays.hashCode(content));
    }
}
