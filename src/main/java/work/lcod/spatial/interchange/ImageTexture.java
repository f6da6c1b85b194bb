package work.lcod.spatial.interchange;

public record ImageTexture(
    String name,
    String description,
    double[] origin,
    double[] axisU,
    double[] axisV,
    String contentType,
    byte[] image
) {}
