package com.gentoro.docextract.source;

import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import javax.imageio.ImageIO;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.cos.COSName;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDResources;
import org.apache.pdfbox.pdmodel.graphics.PDXObject;
import org.apache.pdfbox.pdmodel.graphics.image.PDImageXObject;
import org.apache.pdfbox.rendering.ImageType;
import org.apache.pdfbox.rendering.PDFRenderer;

/** {@link PdfImageExtractor} backed by Apache PDFBox. Images are encoded as PNG. */
public class PdfBoxImageExtractor implements PdfImageExtractor {
  private static final org.slf4j.Logger log =
      com.gentoro.docextract.logging.LoggingService.getLogger(PdfBoxImageExtractor.class);

  @Override
  public List<EmbeddedImage> embeddedImages(Path pdf) throws IOException {
    List<EmbeddedImage> images = new ArrayList<>();
    try (PDDocument document = Loader.loadPDF(pdf.toFile())) {
      int pageNumber = 0;
      for (PDPage page : document.getPages()) {
        pageNumber++;
        PDResources resources = page.getResources();
        if (resources == null) {
          continue;
        }
        for (COSName name : resources.getXObjectNames()) {
          PDXObject xObject = resources.getXObject(name);
          if (xObject instanceof PDImageXObject image) {
            images.add(
                new EmbeddedImage(
                    pageNumber, new BytesImageRef(toPng(image.getImage()), "image/png")));
          }
        }
      }
      log.debug("Found {} embedded image(s) in {}", images.size(), pdf.getFileName());
    }
    return images;
  }

  @Override
  public List<ImageRef> renderPages(Path pdf, int dpi) throws IOException {
    List<ImageRef> pages = new ArrayList<>();
    try (PDDocument document = Loader.loadPDF(pdf.toFile())) {
      PDFRenderer renderer = new PDFRenderer(document);
      for (int i = 0; i < document.getNumberOfPages(); i++) {
        BufferedImage image = renderer.renderImageWithDPI(i, dpi, ImageType.RGB);
        pages.add(new BytesImageRef(toPng(image), "image/png"));
      }
      log.debug("Rendered {} page(s) of {} at {} dpi", pages.size(), pdf.getFileName(), dpi);
    }
    return pages;
  }

  private static byte[] toPng(BufferedImage image) throws IOException {
    ByteArrayOutputStream out = new ByteArrayOutputStream();
    ImageIO.write(image, "png", out);
    return out.toByteArray();
  }
}
