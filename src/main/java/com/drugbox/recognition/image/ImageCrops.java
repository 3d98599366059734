package com.drugbox.recognition.image;

import com.drugbox.recognition.core.model.BoundingBox;

import java.awt.Graphics2D;
import java.awt.image.BufferedImage;

public final class ImageCrops {

    private ImageCrops() {
    }

    /**
     * Copies the box out of the source so the crop does not share the source raster.
     */
    public static BufferedImage crop(BufferedImage source, BoundingBox box) {
        BufferedImage out = new BufferedImage(box.width(), box.height(), BufferedImage.TYPE_INT_RGB);
        Graphics2D g = out.createGraphics();
        try {
            g.drawImage(source, 0, 0, box.width(), box.height(),
                    box.x(), box.y(), box.right(), box.bottom(), null);
        } finally {
            g.dispose();
        }
        return out;
    }

    public static boolean isUsable(BufferedImage image) {
        return image != null && image.getWidth() > 0 && image.getHeight() > 0;
    }
}
